package dev.aparikh.msgexplorer.error;

/**
 * The request is malformed for the engine: unknown dimension, filter shape not
 * legal for the dimension kind, wrong number of dimensions and so on.
 */
public class QueryValidationException extends DataTableException {

    public QueryValidationException(String field, String message) {
        super(message, field);
    }

    @Override
    public String getCode() {
        return "VALIDATION_ERROR";
    }
}
