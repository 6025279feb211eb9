package dev.aparikh.msgexplorer.datatable;

import dev.aparikh.msgexplorer.dimension.Dimension;
import dev.aparikh.msgexplorer.filter.FilterSet;

import java.util.List;

/**
 * A validated query with dimensions, filters, measure and groups resolved.
 */
public record ResolvedQuery(
        long datasetId,
        List<Dimension> dimensions,
        FilterSet filterSet,
        Measure measure,
        DisplayMode mode,
        List<ResolvedGroup> groups,
        String searchKey,
        Paging paging
) {
    public ResolvedQuery {
        dimensions = List.copyOf(dimensions);
        groups = groups == null ? List.of() : List.copyOf(groups);
    }

    public boolean hasSearchKey() {
        return searchKey != null && !searchKey.isBlank();
    }
}
