package dev.aparikh.msgexplorer.datatable;

import dev.aparikh.msgexplorer.filter.Filter;
import dev.aparikh.msgexplorer.model.Message;

import java.util.List;
import java.util.function.Predicate;

/**
 * A group with its filters compiled.
 */
public record ResolvedGroup(
        long id,
        String name,
        List<Filter> filters
) implements Predicate<Message> {

    public ResolvedGroup {
        filters = List.copyOf(filters);
    }

    @Override
    public boolean test(Message message) {
        return filters.stream().allMatch(filter -> filter.test(message));
    }
}
