package dev.aparikh.msgexplorer.datatable;

import dev.aparikh.msgexplorer.filter.FilterSpec;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Raw aggregation request. Absent lists are normalized to empty lists so the
 * engine never distinguishes "omitted", "null" and "empty".
 *
 * @param page     1-indexed page; {@code null} for the first page
 * @param pageSize cells per page; {@code null} for the configured default
 */
public record DataTableQuery(
        long datasetId,
        List<String> dimensions,
        List<FilterSpec> filters,
        List<FilterSpec> excludes,
        String measure,
        String mode,
        List<Long> groupIds,
        String searchKey,
        Integer page,
        Integer pageSize
) {
    public DataTableQuery {
        dimensions = normalize(dimensions);
        filters = normalize(filters);
        excludes = normalize(excludes);
        groupIds = normalize(groupIds);
    }

    // null elements are kept so the resolver can report them with their index
    private static <T> List<T> normalize(List<T> values) {
        return values == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(values));
    }

    public static class Builder {
        private final long datasetId;
        private List<String> dimensions;
        private List<FilterSpec> filters;
        private List<FilterSpec> excludes;
        private String measure;
        private String mode;
        private List<Long> groupIds;
        private String searchKey;
        private Integer page;
        private Integer pageSize;

        public Builder(long datasetId) {
            this.datasetId = datasetId;
        }

        public Builder dimensions(String... dimensions) {
            this.dimensions = List.of(dimensions);
            return this;
        }

        public Builder filters(FilterSpec... filters) {
            this.filters = List.of(filters);
            return this;
        }

        public Builder excludes(FilterSpec... excludes) {
            this.excludes = List.of(excludes);
            return this;
        }

        public Builder measure(String measure) {
            this.measure = measure;
            return this;
        }

        public Builder mode(String mode) {
            this.mode = mode;
            return this;
        }

        public Builder groups(Long... groupIds) {
            this.groupIds = List.of(groupIds);
            return this;
        }

        public Builder searchKey(String searchKey) {
            this.searchKey = searchKey;
            return this;
        }

        public Builder page(Integer page) {
            this.page = page;
            return this;
        }

        public Builder pageSize(Integer pageSize) {
            this.pageSize = pageSize;
            return this;
        }

        public DataTableQuery build() {
            return new DataTableQuery(datasetId, dimensions, filters, excludes, measure, mode,
                    groupIds, searchKey, page, pageSize);
        }
    }
}
