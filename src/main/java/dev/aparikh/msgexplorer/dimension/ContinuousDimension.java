package dev.aparikh.msgexplorer.dimension;

import dev.aparikh.msgexplorer.filter.Filter;
import dev.aparikh.msgexplorer.filter.FilterSpec;
import dev.aparikh.msgexplorer.filter.RangeFilter;
import dev.aparikh.msgexplorer.model.Message;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;
import java.util.function.LongUnaryOperator;

/**
 * Ordered integral dimension. Values are bucketed by identity when the working
 * set is small enough (or in scatter mode), otherwise into equal-width bins.
 */
public final class ContinuousDimension extends AbstractDimension {

    private static final long[] NICE_STEPS = {1, 2, 5};

    private final Function<Message, Long> accessor;

    public ContinuousDimension(String key, String field, Function<Message, Long> accessor) {
        super(key, field);
        this.accessor = accessor;
    }

    @Override
    public DimensionKind kind() {
        return DimensionKind.CONTINUOUS;
    }

    public Long value(Message message) {
        return accessor.apply(message);
    }

    @Override
    public Filter compileFilter(FilterSpec spec, String path) {
        rejectPresent(spec.minTime(), path, "min_time");
        rejectPresent(spec.maxTime(), path, "max_time");
        rejectPresent(spec.levels(), path, "levels");
        rejectPresent(spec.value(), path, "value");
        rejectPresent(spec.text(), path, "text");
        if (spec.min() == null && spec.max() == null) {
            throw invalid(path, "Continuous dimension '" + key() + "' requires min and/or max");
        }
        if (spec.min() != null && spec.max() != null && spec.min().compareTo(spec.max()) > 0) {
            throw invalid(path + ".min", "min must be <= max");
        }
        return new RangeFilter(this, spec.min(), spec.max());
    }

    @Override
    public Bucketer bucketer(List<Message> workingSet, BucketingOptions options) {
        LongUnaryOperator binning = options.scatter()
                ? LongUnaryOperator.identity()
                : binning(workingSet, options.maxBins());
        return message -> {
            Long value = value(message);
            return Collections.singletonList(value == null ? null : binning.applyAsLong(value));
        };
    }

    private LongUnaryOperator binning(List<Message> workingSet, int maxBins) {
        long[] values = workingSet.stream()
                .map(this::value)
                .filter(Objects::nonNull)
                .mapToLong(Long::longValue)
                .toArray();
        if (values.length == 0) {
            return LongUnaryOperator.identity();
        }
        long distinct = Arrays.stream(values).distinct().count();
        if (distinct <= maxBins) {
            return LongUnaryOperator.identity();
        }
        long min = Arrays.stream(values).min().getAsLong();
        long max = Arrays.stream(values).max().getAsLong();
        long width = binWidth(min, max, maxBins);
        return value -> Math.floorDiv(value, width) * width;
    }

    /**
     * Smallest width of the form 1, 2 or 5 times a power of ten that covers
     * {@code [min, max]} with at most {@code maxBins} bins.
     */
    static long binWidth(long min, long max, int maxBins) {
        long magnitude = 1;
        while (true) {
            for (long step : NICE_STEPS) {
                long width = step * magnitude;
                long bins = Math.floorDiv(max, width) - Math.floorDiv(min, width) + 1;
                if (bins <= maxBins) {
                    return width;
                }
            }
            magnitude *= 10;
        }
    }
}
