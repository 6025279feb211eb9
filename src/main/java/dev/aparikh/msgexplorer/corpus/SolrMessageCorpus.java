package dev.aparikh.msgexplorer.corpus;

import dev.aparikh.msgexplorer.config.SolrConfigurationProperties;
import dev.aparikh.msgexplorer.error.CorpusAccessException;
import dev.aparikh.msgexplorer.filter.FilterSet;
import dev.aparikh.msgexplorer.model.Message;
import org.apache.solr.client.solrj.SolrClient;
import org.apache.solr.client.solrj.SolrQuery;
import org.apache.solr.client.solrj.SolrServerException;
import org.apache.solr.client.solrj.response.QueryResponse;
import org.apache.solr.common.SolrDocument;
import org.apache.solr.common.SolrException;
import org.apache.solr.common.params.CursorMarkParams;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;

import java.io.IOException;
import java.util.List;
import java.util.function.Function;

import static dev.aparikh.msgexplorer.corpus.SolrDocuments.getInstant;
import static dev.aparikh.msgexplorer.corpus.SolrDocuments.getLong;
import static dev.aparikh.msgexplorer.corpus.SolrDocuments.getString;
import static dev.aparikh.msgexplorer.corpus.SolrDocuments.getStrings;

/**
 * Scans the messages core with cursor marks. Exactly expressible filters are
 * pushed down as filter queries; the full filter set is re-applied to every
 * fetched message, so results never depend on what Solr could express.
 */
@Service
class SolrMessageCorpus implements MessageCorpus {

    private static final Logger LOG = LoggerFactory.getLogger(SolrMessageCorpus.class);

    private final SolrClient solr;
    private final SolrConfigurationProperties properties;
    private final SolrFilterTranslator translator = new SolrFilterTranslator();

    SolrMessageCorpus(SolrClient solr, SolrConfigurationProperties properties) {
        this.solr = solr;
        this.properties = properties;
    }

    @Override
    public Flux<Message> itemsMatching(long datasetId, FilterSet filterSet) {
        return Flux.defer(() -> {
            SolrQuery base = buildSolrQuery(datasetId, filterSet);
            LOG.debug("Scanning dataset {} with filter queries {}", datasetId, base.getFilterQueries());
            return Flux.<List<Message>, String>generate(() -> CursorMarkParams.CURSOR_MARK_START, (cursor, sink) -> {
                        SolrQuery q = base.getCopy();
                        q.set(CursorMarkParams.CURSOR_MARK_PARAM, cursor);
                        QueryResponse resp = query(q);
                        sink.next(resp.getResults().stream().map(this::fromSolrDoc).toList());
                        String next = resp.getNextCursorMark();
                        if (next == null || next.equals(cursor)) {
                            sink.complete();
                        }
                        return next;
                    })
                    .flatMapIterable(Function.identity())
                    .filter(filterSet);
        });
    }

    SolrQuery buildSolrQuery(long datasetId, FilterSet filterSet) {
        SolrQuery q = new SolrQuery("*:*");
        q.addFilterQuery(Message.FIELD_DATASET + ":" + datasetId);
        for (String fq : translator.filterQueries(filterSet)) {
            q.addFilterQuery(fq);
        }
        q.setRows(properties.getFetchBatchSize());
        // cursor marks need a total order ending in the unique key
        q.setSort(SolrQuery.SortClause.asc(Message.FIELD_TIME));
        q.addSort(SolrQuery.SortClause.asc(Message.FIELD_ID));
        return q;
    }

    private QueryResponse query(SolrQuery q) {
        try {
            return solr.query(properties.getMessagesCore(), q);
        } catch (SolrServerException | SolrException | IOException e) {
            throw new CorpusAccessException("Message scan failed", e);
        }
    }

    private Message fromSolrDoc(SolrDocument d) {
        Long dataset = getLong(d, Message.FIELD_DATASET);
        return new Message(
                getString(d, Message.FIELD_ID),
                dataset == null ? 0L : dataset,
                getInstant(d, Message.FIELD_TIME),
                getString(d, Message.FIELD_TYPE),
                getString(d, Message.FIELD_SENDER_ID),
                getString(d, Message.FIELD_SENDER_NAME),
                getString(d, Message.FIELD_LANGUAGE),
                getString(d, Message.FIELD_SENTIMENT),
                getString(d, Message.FIELD_TEXT),
                getStrings(d, Message.FIELD_HASHTAGS),
                getStrings(d, Message.FIELD_MENTIONS),
                getStrings(d, Message.FIELD_URLS),
                getStrings(d, Message.FIELD_WORDS),
                getLong(d, Message.FIELD_RETWEET_COUNT),
                getLong(d, Message.FIELD_FAVORITE_COUNT),
                getLong(d, Message.FIELD_SENDER_FOLLOWERS)
        );
    }
}
