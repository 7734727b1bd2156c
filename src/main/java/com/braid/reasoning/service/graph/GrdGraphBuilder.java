package com.braid.reasoning.service.graph;

import com.braid.reasoning.model.FlowDirection;
import com.braid.reasoning.model.FlowEdge;
import com.braid.reasoning.model.FlowNode;
import com.braid.reasoning.model.GrdStructure;
import com.braid.reasoning.service.mermaid.FlowchartSource;
import com.braid.reasoning.service.mermaid.FlowchartStatementParser;
import com.braid.reasoning.service.mermaid.NodeDeclaration;
import com.braid.reasoning.service.mermaid.ParsedStatement;
import com.braid.reasoning.service.mermaid.StatementLine;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Folds parsed statements into a {@link GrdStructure}.
 *
 * Merge rules:
 *   1. Node order is the order of first mention.
 *   2. An annotated mention ({@code A[Label]}) sets label and shape; later annotations win.
 *   3. A bare mention never clears an earlier annotation.
 *   4. Edge endpoints that were never declared become bare nodes with label == id.
 *   5. Edges are kept as written, duplicates included.
 *   6. A lone {@code end} closes the innermost open subgraph; with none open it is a node.
 *
 * An empty diagram yields an empty structure; rejecting it is the validator's job.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class GrdGraphBuilder {

    private final FlowchartStatementParser statementParser;

    /**
     * Parse every statement of {@code source} and build the graph. Stops at the first syntax error.
     */
    public GrdStructure build(FlowchartSource source) {
        List<ParsedStatement> statements = new ArrayList<>();
        for (StatementLine line : source.statements()) {
            statements.add(statementParser.parse(line));
        }
        return build(source.direction(), statements);
    }

    /**
     * Build the graph from already-parsed statements.
     */
    public GrdStructure build(FlowDirection direction, List<ParsedStatement> statements) {
        Map<String, FlowNode> nodes = new LinkedHashMap<>();
        List<FlowEdge> edges = new ArrayList<>();

        int openSubgraphs = 0;

        for (ParsedStatement statement : statements) {
            if (ParsedStatement.SUBGRAPH.equals(statement.directive())) {
                openSubgraphs++;
                continue;
            }
            if (ParsedStatement.END.equals(statement.directive()) && openSubgraphs > 0) {
                openSubgraphs--;
                continue;
            }
            for (NodeDeclaration declaration : statement.nodes()) {
                mergeNode(nodes, declaration);
            }
            for (FlowEdge edge : statement.edges()) {
                nodes.putIfAbsent(edge.fromId(), FlowNode.bare(edge.fromId()));
                nodes.putIfAbsent(edge.toId(), FlowNode.bare(edge.toId()));
                edges.add(edge);
            }
        }

        GrdStructure structure = GrdStructure.of(direction, nodes.values(), edges);
        log.debug("Built GRD with {} nodes and {} edges from {} statements",
                structure.nodeCount(), structure.edgeCount(), statements.size());
        return structure;
    }

    private void mergeNode(Map<String, FlowNode> nodes, NodeDeclaration declaration) {
        FlowNode existing = nodes.get(declaration.id());
        if (!declaration.annotated()) {
            if (existing == null) {
                nodes.put(declaration.id(), FlowNode.bare(declaration.id()));
            }
            return;
        }
        if (existing != null && existing.declared()
                && (!existing.label().equals(declaration.label()) || existing.shape() != declaration.shape())) {
            log.debug("Node '{}' re-declared: [{}] {} -> [{}] {}", declaration.id(),
                    existing.shape(), existing.label(), declaration.shape(), declaration.label());
        }
        // LinkedHashMap keeps the original position on replace
        nodes.put(declaration.id(), FlowNode.declared(declaration.id(), declaration.label(), declaration.shape()));
    }
}
