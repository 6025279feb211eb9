package dev.aparikh.msgexplorer.group;

import dev.aparikh.msgexplorer.config.SolrConfigurationProperties;
import dev.aparikh.msgexplorer.error.CorpusAccessException;
import org.apache.solr.client.solrj.SolrClient;
import org.apache.solr.client.solrj.SolrQuery;
import org.apache.solr.client.solrj.SolrServerException;
import org.apache.solr.client.solrj.response.QueryResponse;
import org.apache.solr.common.SolrDocument;
import org.apache.solr.common.SolrException;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.Optional;

import static dev.aparikh.msgexplorer.corpus.SolrDocuments.getLong;
import static dev.aparikh.msgexplorer.corpus.SolrDocuments.getString;
import static dev.aparikh.msgexplorer.corpus.SolrDocuments.getStrings;

@Service
class SolrGroupCatalog implements GroupCatalog {

    private final SolrClient solr;
    private final SolrConfigurationProperties properties;

    SolrGroupCatalog(SolrClient solr, SolrConfigurationProperties properties) {
        this.solr = solr;
        this.properties = properties;
    }

    @Override
    public Optional<Group> find(long datasetId, long groupId) {
        SolrQuery q = new SolrQuery("*:*");
        q.addFilterQuery(Group.FIELD_ID + ":" + groupId);
        q.addFilterQuery(Group.FIELD_DATASET + ":" + datasetId);
        q.addFilterQuery("-" + Group.FIELD_DELETED + ":true");
        q.setRows(1);
        try {
            QueryResponse resp = solr.query(properties.getGroupsCore(), q);
            return resp.getResults().stream().findFirst().map(this::fromSolrDoc);
        } catch (SolrServerException | SolrException | IOException e) {
            throw new CorpusAccessException("Group lookup failed", e);
        }
    }

    private Group fromSolrDoc(SolrDocument d) {
        Long id = getLong(d, Group.FIELD_ID);
        Long dataset = getLong(d, Group.FIELD_DATASET);
        return new Group(
                id == null ? 0L : id,
                dataset == null ? 0L : dataset,
                getString(d, Group.FIELD_NAME),
                getString(d, Group.FIELD_KEYWORDS),
                getStrings(d, Group.FIELD_INCLUDE_TYPES)
        );
    }
}
