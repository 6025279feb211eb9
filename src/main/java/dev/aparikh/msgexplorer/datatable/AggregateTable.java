package dev.aparikh.msgexplorer.datatable;

import java.util.List;
import java.util.Map;

/**
 * Output of either execution path before assembly.
 *
 * @param cells      cells of the requested page
 * @param domains    domain per dimension key, computed before paging
 * @param totalCells number of cells before paging
 */
record AggregateTable(
        List<TableCell> cells,
        Map<String, List<Object>> domains,
        long totalCells
) {
}
