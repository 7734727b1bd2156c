package com.braid.reasoning.model;

import java.util.Objects;

/**
 * A directed link between two node ids. Edges form a multiset: the same pair may be
 * linked more than once, with or without different labels.
 *
 * @param label     arrow text such as a branch condition; null when the arrow has none
 * @param style     line style, metadata only
 * @param arrowHead whether the source used an arrowhead ({@code -->}) or an open link ({@code ---})
 */
public record FlowEdge(String fromId, String toId, String label, ArrowStyle style, boolean arrowHead) {

    public FlowEdge {
        Objects.requireNonNull(fromId, "fromId must not be null");
        Objects.requireNonNull(toId, "toId must not be null");
        Objects.requireNonNull(style, "style must not be null");
    }

    public static FlowEdge of(String fromId, String toId) {
        return new FlowEdge(fromId, toId, null, ArrowStyle.SOLID, true);
    }

    public static FlowEdge of(String fromId, String toId, String label) {
        return new FlowEdge(fromId, toId, label, ArrowStyle.SOLID, true);
    }
}
