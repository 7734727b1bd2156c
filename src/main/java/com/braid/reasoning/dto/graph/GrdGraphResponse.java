package com.braid.reasoning.dto.graph;

import com.braid.reasoning.model.GrdStructure;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Response DTO for a parsed GRD: nodes in declaration order, edges in source order.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GrdGraphResponse {

    private List<GraphNode> nodes;
    private List<GraphEdge> edges;
    private GraphMetadata metadata;

    public static GrdGraphResponse from(GrdStructure structure) {
        List<GraphNode> nodes = structure.getNodes().values().stream()
                .map(node -> GraphNode.from(node,
                        structure.incoming(node.id()).size(),
                        structure.outgoing(node.id()).size()))
                .toList();

        List<GraphEdge> edges = structure.getEdges().stream()
                .map(GraphEdge::from)
                .toList();

        GraphMetadata metadata = GraphMetadata.builder()
                .direction(structure.getDirection().name())
                .nodeCount(structure.nodeCount())
                .edgeCount(structure.edgeCount())
                .startNodes(structure.startNodes())
                .endNodes(structure.endNodes())
                .build();

        return GrdGraphResponse.builder()
                .nodes(nodes)
                .edges(edges)
                .metadata(metadata)
                .build();
    }
}
