package dev.aparikh.msgexplorer.corpus;

import dev.aparikh.msgexplorer.config.SolrConfigurationProperties;
import dev.aparikh.msgexplorer.error.CorpusAccessException;
import dev.aparikh.msgexplorer.model.Dataset;
import org.apache.solr.client.solrj.SolrClient;
import org.apache.solr.client.solrj.SolrQuery;
import org.apache.solr.client.solrj.SolrServerException;
import org.apache.solr.client.solrj.response.QueryResponse;
import org.apache.solr.common.SolrDocument;
import org.apache.solr.common.SolrException;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.Optional;

import static dev.aparikh.msgexplorer.corpus.SolrDocuments.getInstant;
import static dev.aparikh.msgexplorer.corpus.SolrDocuments.getLong;
import static dev.aparikh.msgexplorer.corpus.SolrDocuments.getString;

@Service
class SolrDatasetCatalog implements DatasetCatalog {

    private final SolrClient solr;
    private final SolrConfigurationProperties properties;

    SolrDatasetCatalog(SolrClient solr, SolrConfigurationProperties properties) {
        this.solr = solr;
        this.properties = properties;
    }

    @Override
    public Optional<Dataset> find(long datasetId) {
        SolrQuery q = new SolrQuery("*:*");
        q.addFilterQuery(Dataset.FIELD_ID + ":" + datasetId);
        q.setRows(1);
        try {
            QueryResponse resp = solr.query(properties.getDatasetsCore(), q);
            return resp.getResults().stream().findFirst().map(this::fromSolrDoc);
        } catch (SolrServerException | SolrException | IOException e) {
            throw new CorpusAccessException("Dataset lookup failed", e);
        }
    }

    private Dataset fromSolrDoc(SolrDocument d) {
        Long id = getLong(d, Dataset.FIELD_ID);
        Long count = getLong(d, Dataset.FIELD_MESSAGE_COUNT);
        return new Dataset(
                id == null ? 0L : id,
                getString(d, Dataset.FIELD_NAME),
                getString(d, Dataset.FIELD_DESCRIPTION),
                count == null ? 0L : count,
                getInstant(d, Dataset.FIELD_START_TIME),
                getInstant(d, Dataset.FIELD_END_TIME)
        );
    }
}
