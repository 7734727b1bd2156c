package com.braid.reasoning.exception;

import java.util.List;

/**
 * Every node has an incoming edge, so there is nowhere to begin. Such a graph is entirely
 * cyclic; the exception carries one of its cycles.
 */
public class NoStartNodeException extends CycleException {

    public NoStartNodeException(int nodeCount, List<String> cycle) {
        super(String.format("No start node: all %d nodes have incoming edges (cycle %s)",
                nodeCount, String.join(" -> ", cycle)), cycle);
    }

    @Override
    public String errorType() {
        return "NoStartNodeError";
    }
}
