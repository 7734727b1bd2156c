package com.braid.reasoning.exception;

import lombok.Getter;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * The diagram contains a directed cycle.
 */
@Getter
public class CycleException extends GrdException {

    // e.g. ["A", "B", "A"]
    private final List<String> cycle;

    public CycleException(List<String> cycle) {
        this("Cycle detected: " + String.join(" -> ", cycle), cycle);
    }

    protected CycleException(String message, List<String> cycle) {
        super(message);
        this.cycle = List.copyOf(cycle);
    }

    /**
     * Distinct node ids on the cycle, in cycle order.
     */
    public Set<String> getCycleNodes() {
        return new LinkedHashSet<>(cycle);
    }

    @Override
    public String errorType() {
        return "CycleError";
    }
}
