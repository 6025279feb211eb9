package dev.aparikh.msgexplorer.explore;

import dev.aparikh.msgexplorer.config.EngineProperties;
import dev.aparikh.msgexplorer.corpus.MessageCorpus;
import dev.aparikh.msgexplorer.datatable.QueryResolver;
import dev.aparikh.msgexplorer.filter.Filter;
import dev.aparikh.msgexplorer.filter.FilterSet;
import dev.aparikh.msgexplorer.filter.FilterSpec;
import dev.aparikh.msgexplorer.model.Message;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Messages matching a keyword expression, optionally limited to some message types.
 */
@Service
public class KeywordSearchService {

    static final String TYPE_DIMENSION = "message_type";

    private final QueryResolver resolver;
    private final MessageCorpus corpus;
    private final EngineProperties properties;

    public KeywordSearchService(QueryResolver resolver, MessageCorpus corpus, EngineProperties properties) {
        this.resolver = resolver;
        this.corpus = corpus;
        this.properties = properties;
    }

    /**
     * @param keywords expression in the group keyword syntax; blank selects every message
     * @param types    message types to keep; empty keeps all
     */
    public List<Message> search(long datasetId, String keywords, List<String> types) {
        List<Filter> filters = new ArrayList<>();
        if (types != null && !types.isEmpty()) {
            filters.addAll(resolver.compile(List.of(FilterSpec.levels(TYPE_DIMENSION, types)), "types_list"));
        }
        filters.addAll(resolver.compileKeywords(keywords, "keywords"));
        resolver.requireDataset(datasetId);

        List<Message> messages = corpus.itemsMatching(datasetId, new FilterSet(filters, List.of()))
                .take(properties.getSearchMessageLimit())
                .collectList()
                .block();
        return messages == null ? List.of() : messages;
    }
}
