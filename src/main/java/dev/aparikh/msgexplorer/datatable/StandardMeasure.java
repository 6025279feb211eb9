package dev.aparikh.msgexplorer.datatable;

import dev.aparikh.msgexplorer.model.Message;

import java.util.HashSet;
import java.util.Set;

/**
 * Measures available to every request.
 */
public enum StandardMeasure implements Measure {

    /**
     * Number of messages in the cell.
     */
    COUNT("count") {
        @Override
        public Accumulator newAccumulator() {
            return new CountAccumulator();
        }
    },

    /**
     * Number of distinct senders in the cell; messages without a sender id are not counted.
     */
    DISTINCT_SENDERS("distinct_senders") {
        @Override
        public Accumulator newAccumulator() {
            return new DistinctSendersAccumulator();
        }
    };

    private final String key;

    StandardMeasure(String key) {
        this.key = key;
    }

    @Override
    public String key() {
        return key;
    }

    private static final class CountAccumulator implements Accumulator {

        private long count;

        @Override
        public void add(Message message) {
            count++;
        }

        @Override
        public Accumulator merge(Accumulator other) {
            count += ((CountAccumulator) other).count;
            return this;
        }

        @Override
        public long value() {
            return count;
        }
    }

    private static final class DistinctSendersAccumulator implements Accumulator {

        private final Set<String> senders = new HashSet<>();

        @Override
        public void add(Message message) {
            if (message.senderId() != null) {
                senders.add(message.senderId());
            }
        }

        @Override
        public Accumulator merge(Accumulator other) {
            senders.addAll(((DistinctSendersAccumulator) other).senders);
            return this;
        }

        @Override
        public long value() {
            return senders.size();
        }
    }
}
