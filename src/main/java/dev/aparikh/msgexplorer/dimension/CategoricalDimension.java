package dev.aparikh.msgexplorer.dimension;

import dev.aparikh.msgexplorer.filter.Filter;
import dev.aparikh.msgexplorer.filter.FilterSpec;
import dev.aparikh.msgexplorer.filter.KeywordFilter;
import dev.aparikh.msgexplorer.filter.KeywordQuery;
import dev.aparikh.msgexplorer.filter.LevelsFilter;
import dev.aparikh.msgexplorer.filter.TextMatch;
import dev.aparikh.msgexplorer.filter.TextSearchFilter;
import dev.aparikh.msgexplorer.filter.TextTokenizer;
import dev.aparikh.msgexplorer.model.Message;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Stream;

/**
 * Discrete label dimension. Multi-valued dimensions (hashtags, words, ...)
 * contribute one bucket per distinct value of a message.
 */
public final class CategoricalDimension extends AbstractDimension {

    private final Function<Message, List<String>> accessor;
    private final TextMatch textMatch;
    private final Map<String, String> labels;

    private CategoricalDimension(String key, String field, Function<Message, List<String>> accessor,
                                 TextMatch textMatch, Map<String, String> labels) {
        super(key, field);
        this.accessor = accessor;
        this.textMatch = textMatch;
        this.labels = Map.copyOf(labels);
    }

    public static CategoricalDimension single(String key, String field, Function<Message, String> accessor,
                                              TextMatch textMatch, Map<String, String> labels) {
        return new CategoricalDimension(key, field,
                message -> Stream.ofNullable(accessor.apply(message)).toList(),
                textMatch, labels);
    }

    public static CategoricalDimension multi(String key, String field, Function<Message, List<String>> accessor,
                                             TextMatch textMatch) {
        return new CategoricalDimension(key, field, accessor, textMatch, Map.of());
    }

    @Override
    public DimensionKind kind() {
        return DimensionKind.CATEGORICAL;
    }

    public TextMatch textMatch() {
        return textMatch;
    }

    @Override
    public Map<String, String> labels() {
        return labels;
    }

    /**
     * Non-null values of the message along this dimension.
     */
    public List<String> values(Message message) {
        List<String> values = accessor.apply(message);
        if (values == null) {
            return List.of();
        }
        return values.stream().filter(Objects::nonNull).toList();
    }

    @Override
    public Filter compileFilter(FilterSpec spec, String path) {
        rejectPresent(spec.min(), path, "min");
        rejectPresent(spec.max(), path, "max");
        rejectPresent(spec.minTime(), path, "min_time");
        rejectPresent(spec.maxTime(), path, "max_time");

        int shapes = (spec.levels() != null ? 1 : 0) + (spec.value() != null ? 1 : 0) + (spec.text() != null ? 1 : 0);
        if (shapes == 0) {
            throw invalid(path, "Categorical dimension '" + key() + "' requires one of levels, value or text");
        }
        if (shapes > 1) {
            throw invalid(path, "Categorical dimension '" + key() + "' accepts only one of levels, value or text");
        }

        if (spec.levels() != null) {
            if (spec.levels().isEmpty() || spec.levels().stream().anyMatch(Objects::isNull)) {
                throw invalid(path + ".levels", "levels must be a non-empty list of values");
            }
            return new LevelsFilter(this, new LinkedHashSet<>(spec.levels()));
        }
        if (spec.value() != null) {
            return new LevelsFilter(this, Collections.singleton(spec.value()));
        }
        List<String> tokens = TextTokenizer.tokenize(spec.text());
        if (tokens.isEmpty()) {
            throw invalid(path + ".text", "text must contain at least one search token");
        }
        return new TextSearchFilter(this, tokens);
    }

    /**
     * Compiles a keyword expression (see {@link KeywordQuery}) over this dimension;
     * empty when the expression selects everything.
     */
    public Optional<Filter> compileKeywords(String keywords) {
        KeywordQuery query = KeywordQuery.parse(keywords);
        return query.isMatchAll() ? Optional.empty() : Optional.of(new KeywordFilter(this, query));
    }

    @Override
    public Bucketer bucketer(List<Message> workingSet, BucketingOptions options) {
        return message -> {
            List<String> values = values(message);
            if (values.isEmpty()) {
                return Collections.singletonList(null);
            }
            return new ArrayList<>(new LinkedHashSet<>(values));
        };
    }
}
