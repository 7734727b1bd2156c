package com.braid.reasoning.model;

/**
 * Layout direction declared in the flowchart header ({@code flowchart TD}).
 */
public enum FlowDirection {
    TD, TB, BT, LR, RL;

    /**
     * Get the direction from a header token, case-insensitive.
     * Returns null for anything that is not a direction.
     */
    public static FlowDirection fromString(String value) {
        if (value == null) return null;
        try {
            return valueOf(value.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
