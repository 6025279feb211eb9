package dev.aparikh.msgexplorer.filter;

import dev.aparikh.msgexplorer.model.Message;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;

/**
 * Normalized filters and excludes of one query. A message passes when it
 * matches every filter and does not match every exclude at once.
 */
public record FilterSet(
        List<Filter> filters,
        List<Filter> excludes
) implements Predicate<Message> {

    public static final FilterSet EMPTY = new FilterSet(List.of(), List.of());

    public FilterSet {
        filters = filters == null ? List.of() : List.copyOf(filters);
        excludes = excludes == null ? List.of() : List.copyOf(excludes);
    }

    public boolean isEmpty() {
        return filters.isEmpty() && excludes.isEmpty();
    }

    /**
     * Returns a set with {@code additional} appended to the filters.
     */
    public FilterSet and(List<Filter> additional) {
        if (additional.isEmpty()) {
            return this;
        }
        List<Filter> combined = new ArrayList<>(filters);
        combined.addAll(additional);
        return new FilterSet(combined, excludes);
    }

    @Override
    public boolean test(Message message) {
        for (Filter filter : filters) {
            if (!filter.test(message)) {
                return false;
            }
        }
        return !isExcluded(message);
    }

    private boolean isExcluded(Message message) {
        if (excludes.isEmpty()) {
            return false;
        }
        for (Filter exclude : excludes) {
            if (!exclude.test(message)) {
                return false;
            }
        }
        return true;
    }
}
