package dev.aparikh.msgexplorer.dimension;

import dev.aparikh.msgexplorer.error.QueryValidationException;

abstract class AbstractDimension implements Dimension {

    private final String key;
    private final String field;

    AbstractDimension(String key, String field) {
        this.key = key;
        this.field = field;
    }

    @Override
    public String key() {
        return key;
    }

    @Override
    public String field() {
        return field;
    }

    void rejectPresent(Object value, String path, String name) {
        if (value != null) {
            throw new QueryValidationException(path + "." + name,
                    "Filter field '" + name + "' is not allowed for " + kind().jsonValue()
                            + " dimension '" + key + "'");
        }
    }

    QueryValidationException invalid(String path, String message) {
        return new QueryValidationException(path, message);
    }

    @Override
    public String toString() {
        return kind().jsonValue() + ":" + key;
    }
}
