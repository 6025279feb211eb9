package dev.aparikh.msgexplorer.datatable;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * Uniform result of an aggregation, whichever path produced it.
 */
public record DataTableResult(
        List<String> dimensions,
        List<TableCell> table,
        Map<String, List<Object>> domains,
        @JsonProperty("domain_labels") Map<String, Map<String, String>> domainLabels,
        @JsonProperty("total_cells") long totalCells,
        int page,
        @JsonProperty("page_size") int pageSize
) {
}
