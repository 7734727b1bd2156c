package com.braid.reasoning.model;

import java.util.Objects;

/**
 * A single diagram box.
 *
 * @param id       identifier, unique within a graph
 * @param label    display text; equals {@code id} when the node was never annotated
 * @param shape    bracket shape; {@link NodeShape#RECTANGLE} for bare nodes
 * @param declared true when some statement gave the node an explicit shape and label
 */
public record FlowNode(String id, String label, NodeShape shape, boolean declared) {

    public FlowNode {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(label, "label must not be null");
        Objects.requireNonNull(shape, "shape must not be null");
    }

    public static FlowNode bare(String id) {
        return new FlowNode(id, id, NodeShape.RECTANGLE, false);
    }

    public static FlowNode declared(String id, String label, NodeShape shape) {
        return new FlowNode(id, label, shape, true);
    }
}
