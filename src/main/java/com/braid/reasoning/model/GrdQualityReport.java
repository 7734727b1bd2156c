package com.braid.reasoning.model;

/**
 * Quality scores for a GRD, each in [0, 1].
 */
public record GrdQualityReport(double structuralValidity, double completeness,
                               double executionTraceability, double overallQuality) {

    public static GrdQualityReport zero() {
        return new GrdQualityReport(0.0, 0.0, 0.0, 0.0);
    }
}
