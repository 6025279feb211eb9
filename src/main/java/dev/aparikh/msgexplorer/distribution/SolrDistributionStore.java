package dev.aparikh.msgexplorer.distribution;

import dev.aparikh.msgexplorer.config.SolrConfigurationProperties;
import dev.aparikh.msgexplorer.error.CorpusAccessException;
import dev.aparikh.msgexplorer.filter.TextTokenizer;
import org.apache.solr.client.solrj.SolrClient;
import org.apache.solr.client.solrj.SolrQuery;
import org.apache.solr.client.solrj.SolrServerException;
import org.apache.solr.client.solrj.response.QueryResponse;
import org.apache.solr.client.solrj.util.ClientUtils;
import org.apache.solr.common.SolrDocument;
import org.apache.solr.common.SolrException;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.List;

import static dev.aparikh.msgexplorer.corpus.SolrDocuments.getLong;
import static dev.aparikh.msgexplorer.corpus.SolrDocuments.getString;

/**
 * Reads the distributions core. Each document is one
 * {@code (dataset_id, dimension, level, count)} tuple; {@code level_lower}
 * holds the lowercased level for prefix search.
 */
@Service
class SolrDistributionStore implements DistributionStore {

    static final String FIELD_DATASET = "dataset_id";
    static final String FIELD_DIMENSION = "dimension";
    static final String FIELD_LEVEL = "level";
    static final String FIELD_LEVEL_LOWER = "level_lower";
    static final String FIELD_COUNT = "count";

    private final SolrClient solr;
    private final SolrConfigurationProperties properties;

    SolrDistributionStore(SolrClient solr, SolrConfigurationProperties properties) {
        this.solr = solr;
        this.properties = properties;
    }

    @Override
    public boolean covers(long datasetId, String dimension) {
        SolrQuery q = baseQuery(datasetId, dimension);
        q.setRows(0); // We only want the count, no documents
        return query(q).getResults().getNumFound() > 0;
    }

    @Override
    public DistributionPage page(long datasetId, String dimension, String searchKey, int page, int pageSize) {
        SolrQuery q = baseQuery(datasetId, dimension);
        String prefix = TextTokenizer.normalize(searchKey);
        if (!prefix.isEmpty()) {
            q.addFilterQuery(FIELD_LEVEL_LOWER + ":" + ClientUtils.escapeQueryChars(prefix) + "*");
        }
        long offset = (long) (page - 1) * pageSize;
        if (offset > Integer.MAX_VALUE) {
            // past any page Solr can address; only the total is needed
            q.setRows(0);
            return new DistributionPage(List.of(), query(q).getResults().getNumFound());
        }
        q.setSort(SolrQuery.SortClause.desc(FIELD_COUNT));
        q.addSort(SolrQuery.SortClause.asc(FIELD_LEVEL));
        q.setStart((int) offset);
        q.setRows(pageSize);

        QueryResponse resp = query(q);
        return new DistributionPage(
                resp.getResults().stream().map(this::fromSolrDoc).toList(),
                resp.getResults().getNumFound()
        );
    }

    private SolrQuery baseQuery(long datasetId, String dimension) {
        SolrQuery q = new SolrQuery("*:*");
        q.addFilterQuery(FIELD_DATASET + ":" + datasetId);
        q.addFilterQuery(FIELD_DIMENSION + ":" + ClientUtils.escapeQueryChars(dimension));
        return q;
    }

    private QueryResponse query(SolrQuery q) {
        try {
            return solr.query(properties.getDistributionsCore(), q);
        } catch (SolrServerException | SolrException | IOException e) {
            throw new CorpusAccessException("Distribution lookup failed", e);
        }
    }

    private DistributionEntry fromSolrDoc(SolrDocument d) {
        Long count = getLong(d, FIELD_COUNT);
        return new DistributionEntry(getString(d, FIELD_LEVEL), count == null ? 0L : count);
    }
}
