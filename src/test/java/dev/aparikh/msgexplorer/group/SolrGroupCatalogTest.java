package dev.aparikh.msgexplorer.group;

import dev.aparikh.msgexplorer.config.SolrConfigurationProperties;
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

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SolrGroupCatalogTest {

    @Mock
    private SolrClient solrClient;

    @Mock
    private QueryResponse queryResponse;

    private SolrGroupCatalog catalog;

    @BeforeEach
    void setUp() {
        SolrConfigurationProperties properties = new SolrConfigurationProperties();
        properties.setBaseUrl("http://localhost:8983/solr");
        catalog = new SolrGroupCatalog(solrClient, properties);
    }

    @Test
    void findExcludesDeletedGroupsOfOtherDatasets() throws Exception {
        SolrDocument d = new SolrDocument();
        d.setField(Group.FIELD_ID, 7L);
        d.setField(Group.FIELD_DATASET, 1L);
        d.setField(Group.FIELD_NAME, "Soup");
        d.setField(Group.FIELD_KEYWORDS, "soup lad");
        d.setField(Group.FIELD_INCLUDE_TYPES, List.of("tweet", "reply"));
        SolrDocumentList docs = new SolrDocumentList();
        docs.add(d);
        when(queryResponse.getResults()).thenReturn(docs);
        when(solrClient.query(eq("groups"), any(SolrQuery.class))).thenReturn(queryResponse);

        assertThat(catalog.find(1L, 7L)).contains(new Group(7L, 1L, "Soup", "soup lad", List.of("tweet", "reply")));

        ArgumentCaptor<SolrQuery> captor = ArgumentCaptor.forClass(SolrQuery.class);
        verify(solrClient).query(eq("groups"), captor.capture());
        assertThat(captor.getValue().getFilterQueries()).containsExactly("id:7", "dataset_id:1", "-deleted:true");
    }

    @Test
    void findReturnsEmptyWhenMissing() throws Exception {
        when(queryResponse.getResults()).thenReturn(new SolrDocumentList());
        when(solrClient.query(eq("groups"), any(SolrQuery.class))).thenReturn(queryResponse);

        assertThat(catalog.find(1L, 8L)).isEmpty();
    }
}
