package com.braid.reasoning.model;

import java.util.List;

/**
 * One entry of an execution plan.
 *
 * @param stepId     node id
 * @param stepNumber 1-based position in the execution order
 * @param label      node label
 * @param dependsOn  ids of nodes with an edge into this node, in edge declaration order
 */
public record ExecutionStep(String stepId, int stepNumber, String label, List<String> dependsOn) {

    public ExecutionStep {
        dependsOn = dependsOn == null ? List.of() : List.copyOf(dependsOn);
    }

    public boolean isEntryStep() {
        return dependsOn.isEmpty();
    }
}
