package dev.aparikh.msgexplorer.distribution;

/**
 * Read-only view of the level counts the enrichment pipeline precomputes per
 * dataset and categorical dimension. The engine never refreshes it.
 */
public interface DistributionStore {

    /**
     * Whether any precomputed entries exist for the dimension of the dataset.
     */
    boolean covers(long datasetId, String dimension);

    /**
     * Ranked levels of a dimension.
     *
     * @param searchKey optional case-insensitive level prefix; {@code null} or blank for all levels
     * @param page      1-indexed page
     * @param pageSize  entries per page
     */
    DistributionPage page(long datasetId, String dimension, String searchKey, int page, int pageSize);
}
