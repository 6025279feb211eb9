package dev.aparikh.msgexplorer.error;

/**
 * Base class for structured query failures. Every subclass carries a stable
 * error code and the request field that caused it, so the REST boundary can
 * map it without inspecting messages.
 */
public abstract class DataTableException extends RuntimeException {

    private final String field;

    protected DataTableException(String message, String field) {
        super(message);
        this.field = field;
    }

    public String getField() {
        return field;
    }

    public abstract String getCode();
}
