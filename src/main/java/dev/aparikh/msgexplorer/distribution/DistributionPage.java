package dev.aparikh.msgexplorer.distribution;

import java.util.List;

/**
 * A page of ranked distribution entries.
 *
 * @param entries     entries ordered by count descending, then level ascending
 * @param totalLevels number of levels matching the request before paging
 */
public record DistributionPage(
        List<DistributionEntry> entries,
        long totalLevels
) {
    public DistributionPage {
        entries = entries == null ? List.of() : List.copyOf(entries);
    }
}
