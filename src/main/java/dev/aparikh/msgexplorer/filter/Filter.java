package dev.aparikh.msgexplorer.filter;

import dev.aparikh.msgexplorer.dimension.Dimension;
import dev.aparikh.msgexplorer.model.Message;

import java.util.function.Predicate;

/**
 * A validated predicate bound to exactly one dimension.
 */
public interface Filter extends Predicate<Message> {

    Dimension dimension();
}
