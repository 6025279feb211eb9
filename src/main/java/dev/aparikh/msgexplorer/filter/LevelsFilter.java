package dev.aparikh.msgexplorer.filter;

import dev.aparikh.msgexplorer.dimension.CategoricalDimension;
import dev.aparikh.msgexplorer.model.Message;

import java.util.Set;

/**
 * Set membership on a categorical dimension. A multi-valued message matches
 * when any of its values is in the set.
 */
public record LevelsFilter(
        CategoricalDimension dimension,
        Set<String> levels
) implements Filter {

    public LevelsFilter {
        levels = Set.copyOf(levels);
    }

    @Override
    public boolean test(Message message) {
        return dimension.values(message).stream().anyMatch(levels::contains);
    }
}
