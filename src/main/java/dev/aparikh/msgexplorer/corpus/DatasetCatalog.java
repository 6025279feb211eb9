package dev.aparikh.msgexplorer.corpus;

import dev.aparikh.msgexplorer.model.Dataset;

import java.util.Optional;

/**
 * Lookup of dataset catalog records.
 */
public interface DatasetCatalog {

    Optional<Dataset> find(long datasetId);
}
