package dev.aparikh.msgexplorer.filter;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

/**
 * Untyped filter as received from a caller. Which fields may be set depends on
 * the kind of the referenced dimension; {@code Dimension#compileFilter} checks
 * the shape and turns it into a {@link Filter}.
 */
public record FilterSpec(
        String dimension,
        BigDecimal min,
        BigDecimal max,
        Instant minTime,
        Instant maxTime,
        List<String> levels,
        String value,
        String text
) {

    public static FilterSpec levels(String dimension, List<String> levels) {
        return new FilterSpec(dimension, null, null, null, null, levels, null, null);
    }

    public static FilterSpec value(String dimension, String value) {
        return new FilterSpec(dimension, null, null, null, null, null, value, null);
    }

    public static FilterSpec text(String dimension, String text) {
        return new FilterSpec(dimension, null, null, null, null, null, null, text);
    }

    public static FilterSpec range(String dimension, BigDecimal min, BigDecimal max) {
        return new FilterSpec(dimension, min, max, null, null, null, null, null);
    }

    public static FilterSpec timeWindow(String dimension, Instant minTime, Instant maxTime) {
        return new FilterSpec(dimension, null, null, minTime, maxTime, null, null, null);
    }
}
