package dev.aparikh.msgexplorer.dimension;

/**
 * Request-independent bucketing settings plus the scatter flag derived from the
 * display mode.
 *
 * @param granularity truncation unit for temporal dimensions
 * @param maxBins     upper bound on bins for continuous and auto-granularity temporal dimensions
 * @param scatter     when true, continuous dimensions bucket by identity
 */
public record BucketingOptions(
        TimeGranularity granularity,
        int maxBins,
        boolean scatter
) {
    public BucketingOptions {
        if (granularity == null) {
            throw new IllegalArgumentException("granularity must be provided");
        }
        if (maxBins <= 0) {
            throw new IllegalArgumentException("maxBins must be > 0");
        }
    }
}
