package dev.aparikh.msgexplorer.filter;

import dev.aparikh.msgexplorer.dimension.TemporalDimension;
import dev.aparikh.msgexplorer.model.Message;

import java.time.Instant;

/**
 * Inclusive time window; a {@code null} bound is open.
 */
public record TimeWindowFilter(
        TemporalDimension dimension,
        Instant minTime,
        Instant maxTime
) implements Filter {

    @Override
    public boolean test(Message message) {
        Instant time = dimension.value(message);
        if (time == null) {
            return false;
        }
        return (minTime == null || !time.isBefore(minTime))
                && (maxTime == null || !time.isAfter(maxTime));
    }
}
