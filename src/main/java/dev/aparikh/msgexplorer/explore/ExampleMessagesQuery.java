package dev.aparikh.msgexplorer.explore;

import dev.aparikh.msgexplorer.filter.FilterSpec;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Request for sample messages of a slice: the filters plus a focus (the
 * selected cell) minus the excludes, optionally limited to groups.
 */
public record ExampleMessagesQuery(
        long datasetId,
        List<FilterSpec> filters,
        List<FilterSpec> focus,
        List<FilterSpec> excludes,
        List<Long> groupIds
) {
    public ExampleMessagesQuery {
        filters = normalize(filters);
        focus = normalize(focus);
        excludes = normalize(excludes);
        groupIds = normalize(groupIds);
    }

    // null elements are kept so the resolver can report them with their index
    private static <T> List<T> normalize(List<T> values) {
        return values == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(values));
    }
}
