package dev.aparikh.msgexplorer.dimension;

import dev.aparikh.msgexplorer.model.Message;

import java.util.List;

/**
 * Maps one message to the bucket values it contributes to along a dimension.
 * Single-valued dimensions return exactly one element, which is {@code null}
 * when the message has no value. Multi-valued dimensions return each distinct
 * value once.
 */
@FunctionalInterface
public interface Bucketer {

    List<Object> buckets(Message message);
}
