package dev.aparikh.msgexplorer.datatable;

import dev.aparikh.msgexplorer.model.Message;

/**
 * Aggregate computed per table cell.
 */
public interface Measure {

    String key();

    Accumulator newAccumulator();

    /**
     * Mutable per-cell state. {@link #merge} must be associative and
     * commutative so partial accumulations can be combined in any order.
     */
    interface Accumulator {

        void add(Message message);

        Accumulator merge(Accumulator other);

        long value();
    }
}
