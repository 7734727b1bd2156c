package com.braid.reasoning.model;

import com.braid.reasoning.exception.ReferentialIntegrityException;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Parsed Guided Reasoning Diagram: nodes in declaration order and edges in source order,
 * with adjacency and reverse adjacency derived once at construction.
 *
 * Instances are immutable. Every edge endpoint is guaranteed to be a known node.
 */
public final class GrdStructure {

    private static final GrdStructure EMPTY = new GrdStructure(FlowDirection.TD, Map.of(), List.of());

    private final FlowDirection direction;
    private final Map<String, FlowNode> nodes;
    private final List<FlowEdge> edges;
    private final Map<String, Integer> declarationIndex;
    private final Map<String, List<FlowEdge>> outgoing;
    private final Map<String, List<FlowEdge>> incoming;

    private GrdStructure(FlowDirection direction, Map<String, FlowNode> nodes, List<FlowEdge> edges) {
        this.direction = direction;
        this.nodes = Collections.unmodifiableMap(new LinkedHashMap<>(nodes));
        this.edges = List.copyOf(edges);

        Map<String, Integer> index = new LinkedHashMap<>();
        Map<String, List<FlowEdge>> out = new LinkedHashMap<>();
        Map<String, List<FlowEdge>> in = new LinkedHashMap<>();
        for (String id : this.nodes.keySet()) {
            index.put(id, index.size());
            out.put(id, new ArrayList<>());
            in.put(id, new ArrayList<>());
        }
        for (FlowEdge edge : this.edges) {
            out.get(edge.fromId()).add(edge);
            in.get(edge.toId()).add(edge);
        }
        out.replaceAll((id, list) -> List.copyOf(list));
        in.replaceAll((id, list) -> List.copyOf(list));

        this.declarationIndex = Collections.unmodifiableMap(index);
        this.outgoing = Collections.unmodifiableMap(out);
        this.incoming = Collections.unmodifiableMap(in);
    }

    public static GrdStructure empty() {
        return EMPTY;
    }

    /**
     * Create a structure from nodes (iteration order is declaration order) and edges.
     *
     * @throws ReferentialIntegrityException if an edge names a node that is not in {@code nodes}
     */
    public static GrdStructure of(FlowDirection direction, Collection<FlowNode> nodes, List<FlowEdge> edges) {
        Objects.requireNonNull(nodes, "nodes must not be null");
        Objects.requireNonNull(edges, "edges must not be null");

        Map<String, FlowNode> byId = new LinkedHashMap<>();
        for (FlowNode node : nodes) {
            byId.put(node.id(), node);
        }
        for (FlowEdge edge : edges) {
            if (!byId.containsKey(edge.fromId())) {
                throw new ReferentialIntegrityException(edge.fromId(), edge);
            }
            if (!byId.containsKey(edge.toId())) {
                throw new ReferentialIntegrityException(edge.toId(), edge);
            }
        }
        return new GrdStructure(direction == null ? FlowDirection.TD : direction, byId, edges);
    }

    public FlowDirection getDirection() {
        return direction;
    }

    public Map<String, FlowNode> getNodes() {
        return nodes;
    }

    public List<FlowEdge> getEdges() {
        return edges;
    }

    public boolean isEmpty() {
        return nodes.isEmpty();
    }

    public int nodeCount() {
        return nodes.size();
    }

    public int edgeCount() {
        return edges.size();
    }

    public boolean containsNode(String id) {
        return nodes.containsKey(id);
    }

    public FlowNode node(String id) {
        FlowNode node = nodes.get(id);
        if (node == null) {
            throw new IllegalArgumentException("Unknown node id: " + id);
        }
        return node;
    }

    /**
     * Position of the node's first declaration in the source, 0-based.
     */
    public int declarationIndex(String id) {
        Integer idx = declarationIndex.get(id);
        if (idx == null) {
            throw new IllegalArgumentException("Unknown node id: " + id);
        }
        return idx;
    }

    public List<FlowEdge> outgoing(String id) {
        return outgoing.getOrDefault(id, List.of());
    }

    public List<FlowEdge> incoming(String id) {
        return incoming.getOrDefault(id, List.of());
    }

    public int inDegree(String id) {
        return incoming(id).size();
    }

    /**
     * Distinct source nodes of the edges into {@code id}, in edge declaration order.
     */
    public List<String> predecessors(String id) {
        Set<String> result = new LinkedHashSet<>();
        for (FlowEdge edge : incoming(id)) {
            result.add(edge.fromId());
        }
        return List.copyOf(result);
    }

    /**
     * Nodes with no incoming edge, in declaration order.
     */
    public List<String> startNodes() {
        return nodes.keySet().stream()
                .filter(id -> incoming(id).isEmpty())
                .toList();
    }

    /**
     * Nodes with no outgoing edge, in declaration order.
     */
    public List<String> endNodes() {
        return nodes.keySet().stream()
                .filter(id -> outgoing(id).isEmpty())
                .toList();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof GrdStructure other)) return false;
        return direction == other.direction
                && new ArrayList<>(nodes.values()).equals(new ArrayList<>(other.nodes.values()))
                && edges.equals(other.edges);
    }

    @Override
    public int hashCode() {
        return Objects.hash(direction, new ArrayList<>(nodes.values()), edges);
    }

    @Override
    public String toString() {
        return "GrdStructure{direction=" + direction + ", nodes=" + nodes.keySet() + ", edges=" + edges.size() + "}";
    }
}
