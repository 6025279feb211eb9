package dev.aparikh.msgexplorer.dimension;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.time.temporal.TemporalAdjusters;
import java.util.List;

/**
 * Truncation units for temporal bucketing. All truncation happens in UTC.
 * {@link #AUTO} is resolved per working set via {@link #resolve(Instant, Instant, int)}.
 */
public enum TimeGranularity {
    SECOND,
    MINUTE,
    HOUR,
    DAY,
    WEEK,
    MONTH,
    AUTO;

    private static final List<TimeGranularity> CONCRETE = List.of(SECOND, MINUTE, HOUR, DAY, WEEK, MONTH);

    public Instant truncate(Instant instant) {
        return switch (this) {
            case SECOND -> instant.truncatedTo(ChronoUnit.SECONDS);
            case MINUTE -> instant.truncatedTo(ChronoUnit.MINUTES);
            case HOUR -> instant.truncatedTo(ChronoUnit.HOURS);
            case DAY -> instant.truncatedTo(ChronoUnit.DAYS);
            case WEEK -> utcDay(instant)
                    .with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY))
                    .toInstant();
            case MONTH -> utcDay(instant).withDayOfMonth(1).toInstant();
            case AUTO -> throw new IllegalStateException("AUTO granularity must be resolved before truncating");
        };
    }

    /**
     * Number of buckets spanned by {@code [min, max]} at this granularity.
     */
    long bucketCount(Instant min, Instant max) {
        Instant first = truncate(min);
        Instant last = truncate(max);
        return switch (this) {
            case SECOND -> ChronoUnit.SECONDS.between(first, last) + 1;
            case MINUTE -> ChronoUnit.MINUTES.between(first, last) + 1;
            case HOUR -> ChronoUnit.HOURS.between(first, last) + 1;
            case DAY -> ChronoUnit.DAYS.between(first, last) + 1;
            case WEEK -> ChronoUnit.DAYS.between(first, last) / 7 + 1;
            case MONTH -> ChronoUnit.MONTHS.between(
                    first.atZone(ZoneOffset.UTC), last.atZone(ZoneOffset.UTC)) + 1;
            case AUTO -> throw new IllegalStateException("AUTO granularity has no bucket count");
        };
    }

    /**
     * Returns this granularity, or for {@link #AUTO} the finest concrete one whose
     * bucket count over the span stays within {@code maxBins}.
     */
    public TimeGranularity resolve(Instant min, Instant max, int maxBins) {
        if (this != AUTO) {
            return this;
        }
        if (min == null || max == null) {
            return DAY;
        }
        for (TimeGranularity candidate : CONCRETE) {
            if (candidate.bucketCount(min, max) <= maxBins) {
                return candidate;
            }
        }
        return MONTH;
    }

    private static ZonedDateTime utcDay(Instant instant) {
        return instant.atZone(ZoneOffset.UTC).truncatedTo(ChronoUnit.DAYS);
    }
}
