package com.braid.reasoning.model;

/**
 * Shape of a flowchart node, inferred from the bracket pair around its label.
 * Shape is metadata only; it never changes graph semantics.
 */
public enum NodeShape {
    SUBROUTINE("[[", "]]"),
    STADIUM("([", "])"),
    CYLINDER("[(", ")]"),
    CIRCLE("((", "))"),
    HEXAGON("{{", "}}"),
    RECTANGLE("[", "]"),
    ROUNDED("(", ")"),
    DIAMOND("{", "}");

    private final String open;
    private final String close;

    NodeShape(String open, String close) {
        this.open = open;
        this.close = close;
    }

    public String open() {
        return open;
    }

    public String close() {
        return close;
    }

    /**
     * Wrap a label in this shape's brackets, e.g. {@code [Label]}.
     */
    public String wrap(String label) {
        return open + label + close;
    }
}
