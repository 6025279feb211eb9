package dev.aparikh.msgexplorer.filter;

import dev.aparikh.msgexplorer.dimension.ContinuousDimension;
import dev.aparikh.msgexplorer.model.Message;

import java.math.BigDecimal;

/**
 * Inclusive numeric range; a {@code null} bound is open.
 */
public record RangeFilter(
        ContinuousDimension dimension,
        BigDecimal min,
        BigDecimal max
) implements Filter {

    @Override
    public boolean test(Message message) {
        Long raw = dimension.value(message);
        if (raw == null) {
            return false;
        }
        BigDecimal value = BigDecimal.valueOf(raw);
        return (min == null || value.compareTo(min) >= 0)
                && (max == null || value.compareTo(max) <= 0);
    }
}
