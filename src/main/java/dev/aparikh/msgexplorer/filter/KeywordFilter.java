package dev.aparikh.msgexplorer.filter;

import dev.aparikh.msgexplorer.dimension.CategoricalDimension;
import dev.aparikh.msgexplorer.model.Message;

import java.util.List;

/**
 * Keyword expression evaluated against a categorical dimension, usually {@code words}.
 */
public record KeywordFilter(
        CategoricalDimension dimension,
        KeywordQuery query
) implements Filter {

    @Override
    public boolean test(Message message) {
        List<String> values = dimension.values(message).stream()
                .map(TextTokenizer::normalize)
                .toList();
        return query.matches(values, dimension.textMatch());
    }
}
