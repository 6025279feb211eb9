package dev.aparikh.msgexplorer.filter;

import dev.aparikh.msgexplorer.dimension.CategoricalDimension;
import dev.aparikh.msgexplorer.model.Message;

import java.util.List;

/**
 * Free-text search on a categorical dimension. Every token has to match at
 * least one value, using the dimension's {@link TextMatch}.
 */
public record TextSearchFilter(
        CategoricalDimension dimension,
        List<String> tokens
) implements Filter {

    public TextSearchFilter {
        tokens = List.copyOf(tokens);
    }

    @Override
    public boolean test(Message message) {
        List<String> values = dimension.values(message).stream()
                .map(TextTokenizer::normalize)
                .toList();
        if (values.isEmpty()) {
            return false;
        }
        TextMatch match = dimension.textMatch();
        return tokens.stream()
                .allMatch(token -> values.stream().anyMatch(value -> match.matches(value, token)));
    }
}
