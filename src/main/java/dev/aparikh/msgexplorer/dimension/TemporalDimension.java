package dev.aparikh.msgexplorer.dimension;

import dev.aparikh.msgexplorer.filter.Filter;
import dev.aparikh.msgexplorer.filter.FilterSpec;
import dev.aparikh.msgexplorer.filter.TimeWindowFilter;
import dev.aparikh.msgexplorer.model.Message;

import java.time.Instant;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * Timestamp dimension, bucketed by truncation to a granularity in UTC.
 */
public final class TemporalDimension extends AbstractDimension {

    private final Function<Message, Instant> accessor;

    public TemporalDimension(String key, String field, Function<Message, Instant> accessor) {
        super(key, field);
        this.accessor = accessor;
    }

    @Override
    public DimensionKind kind() {
        return DimensionKind.TEMPORAL;
    }

    public Instant value(Message message) {
        return accessor.apply(message);
    }

    @Override
    public Filter compileFilter(FilterSpec spec, String path) {
        rejectPresent(spec.min(), path, "min");
        rejectPresent(spec.max(), path, "max");
        rejectPresent(spec.levels(), path, "levels");
        rejectPresent(spec.value(), path, "value");
        rejectPresent(spec.text(), path, "text");
        if (spec.minTime() == null && spec.maxTime() == null) {
            throw invalid(path, "Temporal dimension '" + key() + "' requires min_time and/or max_time");
        }
        if (spec.minTime() != null && spec.maxTime() != null && spec.minTime().isAfter(spec.maxTime())) {
            throw invalid(path + ".min_time", "min_time must be <= max_time");
        }
        return new TimeWindowFilter(this, spec.minTime(), spec.maxTime());
    }

    @Override
    public Bucketer bucketer(List<Message> workingSet, BucketingOptions options) {
        TimeGranularity granularity = options.granularity();
        if (granularity == TimeGranularity.AUTO) {
            List<Instant> times = workingSet.stream()
                    .map(this::value)
                    .filter(Objects::nonNull)
                    .toList();
            Instant min = times.stream().min(Comparator.naturalOrder()).orElse(null);
            Instant max = times.stream().max(Comparator.naturalOrder()).orElse(null);
            granularity = granularity.resolve(min, max, options.maxBins());
        }
        TimeGranularity resolved = granularity;
        return message -> {
            Instant time = value(message);
            return Collections.singletonList(time == null ? null : resolved.truncate(time));
        };
    }
}
