package dev.aparikh.msgexplorer.distribution;

/**
 * One precomputed level of a categorical dimension with its message count.
 */
public record DistributionEntry(
        String level,
        long count
) {
}
