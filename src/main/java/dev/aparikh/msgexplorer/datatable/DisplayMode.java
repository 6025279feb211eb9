package dev.aparikh.msgexplorer.datatable;

import dev.aparikh.msgexplorer.error.QueryValidationException;

import java.util.Locale;

/**
 * Output shaping hint. Never changes which path serves a request.
 */
public enum DisplayMode {
    DEFAULT,
    /**
     * Running totals along the temporal dimension.
     */
    CUMULATIVE,
    /**
     * Continuous dimensions are not binned.
     */
    SCATTER;

    public static DisplayMode fromKey(String key) {
        if (key == null || key.isBlank()) {
            return DEFAULT;
        }
        try {
            return valueOf(key.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new QueryValidationException("mode", "Unknown mode '" + key + "'");
        }
    }
}
