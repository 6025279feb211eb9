package dev.aparikh.msgexplorer.datatable;

/**
 * Which path serves a query. Chosen once per request; results are never mixed.
 */
public enum ExecutionPath {
    /**
     * Answer read from the precomputed distribution store.
     */
    FAST_PATH,
    /**
     * Answer computed by scanning the corpus.
     */
    GENERAL_PATH
}
