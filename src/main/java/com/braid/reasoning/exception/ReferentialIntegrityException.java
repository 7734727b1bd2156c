package com.braid.reasoning.exception;

import com.braid.reasoning.model.FlowEdge;
import lombok.Getter;

/**
 * An edge references a node id that is not part of the graph.
 */
@Getter
public class ReferentialIntegrityException extends GrdException {

    private final String missingNodeId;
    private final FlowEdge edge;

    public ReferentialIntegrityException(String missingNodeId, FlowEdge edge) {
        super(String.format("Edge %s -> %s references unknown node '%s'",
                edge.fromId(), edge.toId(), missingNodeId));
        this.missingNodeId = missingNodeId;
        this.edge = edge;
    }

    @Override
    public String errorType() {
        return "ReferentialIntegrityError";
    }
}
