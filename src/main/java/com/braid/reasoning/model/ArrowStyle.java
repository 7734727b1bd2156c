package com.braid.reasoning.model;

/**
 * Line style of a flowchart link. Every style is treated as a plain directed edge.
 */
public enum ArrowStyle {
    SOLID('-'),
    DOTTED('.'),
    THICK('=');

    private final char stroke;

    ArrowStyle(char stroke) {
        this.stroke = stroke;
    }

    /**
     * Render the link token, e.g. {@code -->}, {@code -.->}, {@code ==>}.
     */
    public String render(boolean arrowHead) {
        return switch (this) {
            case SOLID -> arrowHead ? "-->" : "---";
            case DOTTED -> arrowHead ? "-.->" : "-.-";
            case THICK -> arrowHead ? "==>" : "===";
        };
    }

    public char stroke() {
        return stroke;
    }
}
