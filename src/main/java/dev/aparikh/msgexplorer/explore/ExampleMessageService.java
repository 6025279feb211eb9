package dev.aparikh.msgexplorer.explore;

import dev.aparikh.msgexplorer.config.EngineProperties;
import dev.aparikh.msgexplorer.corpus.MessageCorpus;
import dev.aparikh.msgexplorer.datatable.QueryResolver;
import dev.aparikh.msgexplorer.datatable.ResolvedGroup;
import dev.aparikh.msgexplorer.filter.Filter;
import dev.aparikh.msgexplorer.filter.FilterSet;
import dev.aparikh.msgexplorer.model.Message;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;

import java.util.List;

@Service
public class ExampleMessageService {

    private final QueryResolver resolver;
    private final MessageCorpus corpus;
    private final EngineProperties properties;

    public ExampleMessageService(QueryResolver resolver, MessageCorpus corpus, EngineProperties properties) {
        this.resolver = resolver;
        this.corpus = corpus;
        this.properties = properties;
    }

    /**
     * First messages of the slice in corpus order, at most the configured limit.
     * With groups, a message qualifies when it belongs to any of them.
     */
    public List<Message> examples(ExampleMessagesQuery query) {
        List<Filter> filters = resolver.compile(query.filters(), "filters");
        List<Filter> focus = resolver.compile(query.focus(), "focus");
        List<Filter> excludes = resolver.compile(query.excludes(), "excludes");
        resolver.requireDataset(query.datasetId());
        List<ResolvedGroup> groups = resolver.resolveGroups(query.datasetId(), query.groupIds());

        FilterSet filterSet = new FilterSet(filters, excludes).and(focus);
        Flux<Message> messages = corpus.itemsMatching(query.datasetId(), filterSet);
        if (!groups.isEmpty()) {
            messages = messages.filter(message -> groups.stream().anyMatch(group -> group.test(message)));
        }
        List<Message> examples = messages.take(properties.getExampleMessageLimit()).collectList().block();
        return examples == null ? List.of() : examples;
    }
}
