package com.braid.reasoning.service.mermaid;

import com.braid.reasoning.model.FlowEdge;

import java.util.List;

/**
 * Result of parsing one statement line.
 *
 * @param nodes     every node mentioned, in order of appearance (a node may appear twice in a chain)
 * @param edges     edges in order of appearance; empty for a lone node or a skipped directive
 * @param directive keyword of a skipped directive line, null for ordinary statements
 */
public record ParsedStatement(int lineNumber, List<NodeDeclaration> nodes, List<FlowEdge> edges, String directive) {

    public static final String SUBGRAPH = "subgraph";
    public static final String END = "end";

    public ParsedStatement {
        nodes = List.copyOf(nodes);
        edges = List.copyOf(edges);
    }

    public ParsedStatement(int lineNumber, List<NodeDeclaration> nodes, List<FlowEdge> edges) {
        this(lineNumber, nodes, edges, null);
    }

    public static ParsedStatement skipped(int lineNumber, String directive) {
        return new ParsedStatement(lineNumber, List.of(), List.of(), directive);
    }

    /**
     * A lone {@code end}: closes the innermost subgraph when one is open, otherwise it is a
     * bare node called {@code end}. Only the builder knows which.
     */
    public static ParsedStatement loneEnd(int lineNumber) {
        return new ParsedStatement(lineNumber, List.of(NodeDeclaration.bare(END)), List.of(), END);
    }

    public boolean isDirective() {
        return directive != null;
    }

    public boolean isEmpty() {
        return nodes.isEmpty() && edges.isEmpty();
    }
}
