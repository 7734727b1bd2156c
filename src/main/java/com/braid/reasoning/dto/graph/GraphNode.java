package com.braid.reasoning.dto.graph;

import com.braid.reasoning.model.FlowNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A GRD node as returned over HTTP.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GraphNode {

    private String id;
    private String label;
    private String shape;       // RECTANGLE, ROUNDED, DIAMOND, SUBROUTINE, ...
    private boolean declared;   // false for nodes only ever referenced by id
    private int inDegree;
    private int outDegree;

    public static GraphNode from(FlowNode node, int inDegree, int outDegree) {
        return GraphNode.builder()
                .id(node.id())
                .label(node.label())
                .shape(node.shape().name())
                .declared(node.declared())
                .inDegree(inDegree)
                .outDegree(outDegree)
                .build();
    }
}
