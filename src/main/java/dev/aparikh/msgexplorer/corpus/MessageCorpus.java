package dev.aparikh.msgexplorer.corpus;

import dev.aparikh.msgexplorer.filter.FilterSet;
import dev.aparikh.msgexplorer.model.Message;
import reactor.core.publisher.Flux;

/**
 * Read access to the messages of a dataset.
 */
public interface MessageCorpus {

    /**
     * Messages of {@code datasetId} that pass {@code filterSet}, in time then id
     * order. The returned flux is cold; each subscription scans again.
     */
    Flux<Message> itemsMatching(long datasetId, FilterSet filterSet);
}
