package com.braid.reasoning.dto.graph;

import com.braid.reasoning.model.FlowEdge;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A GRD edge as returned over HTTP.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GraphEdge {

    private String source;      // Source node ID
    private String target;      // Target node ID
    private String label;       // Branch condition, null when the arrow has none
    private String style;       // SOLID, DOTTED, THICK
    private boolean arrowHead;

    public static GraphEdge from(FlowEdge edge) {
        return GraphEdge.builder()
                .source(edge.fromId())
                .target(edge.toId())
                .label(edge.label())
                .style(edge.style().name())
                .arrowHead(edge.arrowHead())
                .build();
    }
}
