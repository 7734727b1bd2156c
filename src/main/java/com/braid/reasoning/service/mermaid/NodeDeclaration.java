package com.braid.reasoning.service.mermaid;

import com.braid.reasoning.model.NodeShape;

import java.util.Objects;

/**
 * A node mentioned by a statement, either bare ({@code A}) or annotated ({@code A[Label]}).
 *
 * @param shape null for a bare reference
 * @param label null for a bare reference
 */
public record NodeDeclaration(String id, NodeShape shape, String label) {

    public NodeDeclaration {
        Objects.requireNonNull(id, "id must not be null");
        if ((shape == null) != (label == null)) {
            throw new IllegalArgumentException("shape and label must be given together for node " + id);
        }
    }

    public static NodeDeclaration bare(String id) {
        return new NodeDeclaration(id, null, null);
    }

    public boolean annotated() {
        return shape != null;
    }
}
