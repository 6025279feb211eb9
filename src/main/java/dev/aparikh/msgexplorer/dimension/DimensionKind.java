package dev.aparikh.msgexplorer.dimension;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * The closed set of dimension kinds. A kind decides which filter shapes are
 * legal and how values are bucketed.
 */
public enum DimensionKind {
    CATEGORICAL,
    CONTINUOUS,
    TEMPORAL;

    @JsonValue
    public String jsonValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
