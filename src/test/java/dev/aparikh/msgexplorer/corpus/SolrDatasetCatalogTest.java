package dev.aparikh.msgexplorer.corpus;

import dev.aparikh.msgexplorer.config.SolrConfigurationProperties;
import dev.aparikh.msgexplorer.model.Dataset;
import org.apache.solr.client.solrj.SolrClient;
import org.apache.solr.client.solrj.SolrQuery;
import org.apache.solr.client.solrj.response.QueryResponse;
import org.apache.solr.common.SolrDocument;
import org.apache.solr.common.SolrDocumentList;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.Date;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SolrDatasetCatalogTest {

    @Mock
    private SolrClient solrClient;

    @Mock
    private QueryResponse queryResponse;

    private SolrDatasetCatalog catalog;

    @BeforeEach
    void setUp() {
        SolrConfigurationProperties properties = new SolrConfigurationProperties();
        properties.setBaseUrl("http://localhost:8983/solr");
        properties.setDatasetsCore("corpora");
        catalog = new SolrDatasetCatalog(solrClient, properties);
    }

    @Test
    void findMapsTheCatalogRecord() throws Exception {
        SolrDocument d = new SolrDocument();
        d.setField(Dataset.FIELD_ID, 1L);
        d.setField(Dataset.FIELD_NAME, "Soup tweets");
        d.setField(Dataset.FIELD_DESCRIPTION, "Tweets about soup");
        d.setField(Dataset.FIELD_MESSAGE_COUNT, 4);
        d.setField(Dataset.FIELD_START_TIME, Date.from(Instant.parse("2015-02-25T00:00:00Z")));
        d.setField(Dataset.FIELD_END_TIME, "2015-02-28T23:59:59Z");
        SolrDocumentList docs = new SolrDocumentList();
        docs.add(d);
        when(queryResponse.getResults()).thenReturn(docs);
        when(solrClient.query(eq("corpora"), any(SolrQuery.class))).thenReturn(queryResponse);

        Optional<Dataset> dataset = catalog.find(1L);

        assertThat(dataset).contains(new Dataset(1L, "Soup tweets", "Tweets about soup", 4L,
                Instant.parse("2015-02-25T00:00:00Z"), Instant.parse("2015-02-28T23:59:59Z")));
        ArgumentCaptor<SolrQuery> captor = ArgumentCaptor.forClass(SolrQuery.class);
        verify(solrClient).query(eq("corpora"), captor.capture());
        assertThat(captor.getValue().getFilterQueries()).containsExactly("id:1");
    }

    @Test
    void findReturnsEmptyWhenMissing() throws Exception {
        when(queryResponse.getResults()).thenReturn(new SolrDocumentList());
        when(solrClient.query(eq("corpora"), any(SolrQuery.class))).thenReturn(queryResponse);

        assertThat(catalog.find(99L)).isEmpty();
    }
}
