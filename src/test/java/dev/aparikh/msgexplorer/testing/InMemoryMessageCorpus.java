package dev.aparikh.msgexplorer.testing;

import dev.aparikh.msgexplorer.corpus.MessageCorpus;
import dev.aparikh.msgexplorer.filter.FilterSet;
import dev.aparikh.msgexplorer.model.Message;
import reactor.core.publisher.Flux;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Corpus over a fixed list of messages, in list order. Counts scans so tests
 * can assert that nothing was read.
 */
public class InMemoryMessageCorpus implements MessageCorpus {

    private final List<Message> messages;
    private final AtomicInteger scans = new AtomicInteger();

    public InMemoryMessageCorpus(List<Message> messages) {
        this.messages = List.copyOf(messages);
    }

    @Override
    public Flux<Message> itemsMatching(long datasetId, FilterSet filterSet) {
        return Flux.defer(() -> {
            scans.incrementAndGet();
            return Flux.fromIterable(messages)
                    .filter(message -> message.datasetId() == datasetId)
                    .filter(filterSet);
        });
    }

    public int scans() {
        return scans.get();
    }
}
