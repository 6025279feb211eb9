package dev.aparikh.msgexplorer.datatable;

import dev.aparikh.msgexplorer.dimension.Dimension;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Normalizes path output: the table is never null, every requested dimension
 * has a domain entry, and labels are attached for dimensions that define them.
 */
@Component
public class ResultAssembler {

    DataTableResult assemble(ResolvedQuery query, AggregateTable table) {
        List<String> keys = query.dimensions().stream().map(Dimension::key).toList();

        Map<String, List<Object>> domains = new LinkedHashMap<>();
        Map<String, Map<String, String>> domainLabels = new LinkedHashMap<>();
        for (Dimension dimension : query.dimensions()) {
            List<Object> domain = table.domains() == null
                    ? List.of()
                    : table.domains().getOrDefault(dimension.key(), List.of());
            domains.put(dimension.key(), domain);

            if (!dimension.labels().isEmpty()) {
                Map<String, String> labels = new LinkedHashMap<>();
                for (Object level : domain) {
                    if (level == null) continue;
                    String label = dimension.labels().get(level.toString());
                    if (label != null) {
                        labels.put(level.toString(), label);
                    }
                }
                domainLabels.put(dimension.key(), labels);
            }
        }

        List<TableCell> cells = table.cells() == null ? List.of() : table.cells();
        return new DataTableResult(keys, cells, domains, domainLabels, table.totalCells(),
                query.paging().page(), query.paging().pageSize());
    }
}
