package dev.aparikh.msgexplorer.datatable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

/**
 * Bucket values of one cell, one per requested dimension, ordered like the
 * dimensions. Keys sort element by element with {@code null} first.
 */
record CellKey(List<Object> values) implements Comparable<CellKey> {

    static final Comparator<Object> BUCKET_ORDER = Comparator.nullsFirst(CellKey::compareBuckets);

    CellKey {
        values = Collections.unmodifiableList(new ArrayList<>(values));
    }

    static CellKey of(Object... values) {
        List<Object> list = new ArrayList<>(values.length);
        Collections.addAll(list, values);
        return new CellKey(list);
    }

    Object get(int index) {
        return values.get(index);
    }

    /**
     * Copy of the key without the value at {@code index}.
     */
    List<Object> without(int index) {
        List<Object> rest = new ArrayList<>(values);
        rest.remove(index);
        return rest;
    }

    /**
     * Buckets of one dimension share a type (String, Long or Instant).
     */
    @SuppressWarnings("unchecked")
    private static int compareBuckets(Object left, Object right) {
        return ((Comparable<Object>) left).compareTo(right);
    }

    @Override
    public int compareTo(CellKey other) {
        for (int i = 0; i < values.size(); i++) {
            int cmp = BUCKET_ORDER.compare(values.get(i), other.values.get(i));
            if (cmp != 0) {
                return cmp;
            }
        }
        return 0;
    }
}
