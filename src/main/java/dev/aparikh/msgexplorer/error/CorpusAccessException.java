package dev.aparikh.msgexplorer.error;

/**
 * Reading from one of the Solr cores failed.
 */
public class CorpusAccessException extends RuntimeException {

    public CorpusAccessException(String message, Throwable cause) {
        super(message, cause);
    }
}
