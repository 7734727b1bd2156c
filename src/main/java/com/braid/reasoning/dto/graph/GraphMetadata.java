package com.braid.reasoning.dto.graph;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Summary information about a parsed GRD.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GraphMetadata {

    private String direction;
    private int nodeCount;
    private int edgeCount;
    private List<String> startNodes;    // no incoming edges, declaration order
    private List<String> endNodes;      // no outgoing edges, declaration order
}
