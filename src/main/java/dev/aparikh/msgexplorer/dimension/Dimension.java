package dev.aparikh.msgexplorer.dimension;

import dev.aparikh.msgexplorer.filter.Filter;
import dev.aparikh.msgexplorer.filter.FilterSpec;
import dev.aparikh.msgexplorer.model.Message;

import java.util.List;
import java.util.Map;

/**
 * A named axis of analysis. Each kind supplies its own filter validation and
 * bucketing so callers never switch on the kind themselves.
 */
public interface Dimension {

    String key();

    DimensionKind kind();

    /**
     * Name of the corpus field backing this dimension.
     */
    String field();

    /**
     * Validates the shape of {@code spec} against this dimension's kind and
     * compiles it into a predicate.
     *
     * @param path request path of the filter, used in error reports (e.g. {@code filters[0]})
     * @throws dev.aparikh.msgexplorer.error.QueryValidationException if the shape is not legal
     */
    Filter compileFilter(FilterSpec spec, String path);

    /**
     * Builds the bucketing function for one working set. Continuous bins and
     * auto granularity depend on the working set, so they are fixed here once.
     */
    Bucketer bucketer(List<Message> workingSet, BucketingOptions options);

    /**
     * Display labels keyed by level, empty when the levels are self-describing.
     */
    default Map<String, String> labels() {
        return Map.of();
    }
}
