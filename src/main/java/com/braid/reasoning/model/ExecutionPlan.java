package com.braid.reasoning.model;

import java.util.List;

/**
 * A validated GRD together with its ordered steps.
 */
public record ExecutionPlan(GrdStructure structure, List<ExecutionStep> steps) {

    public ExecutionPlan {
        steps = List.copyOf(steps);
    }

    public List<String> order() {
        return steps.stream().map(ExecutionStep::stepId).toList();
    }
}
