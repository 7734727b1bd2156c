package com.braid.reasoning.service.graph;

import com.braid.reasoning.exception.CycleException;
import com.braid.reasoning.exception.EmptyGraphException;
import com.braid.reasoning.exception.GrdException;
import com.braid.reasoning.exception.NoStartNodeException;
import com.braid.reasoning.exception.ReferentialIntegrityException;
import com.braid.reasoning.model.FlowEdge;
import com.braid.reasoning.model.GrdStructure;
import com.braid.reasoning.model.ValidationResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Structural checks for a GRD, applied in order; the first failure wins:
 *   1. at least one node
 *   2. every edge endpoint is a node
 *   3. at least one node without incoming edges
 *   4. no directed cycle
 *
 * A graph without a start node is entirely cyclic, so its error also carries a cycle.
 * Nodes that cannot be reached from any start node are reported as notes, never as errors.
 * Validation reads the structure only.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class GrdGraphValidator {

    private final CycleDetector cycleDetector;

    /**
     * Check the structure without throwing.
     */
    public ValidationResult validate(GrdStructure structure) {
        List<String> notes = structure.isEmpty() ? List.of() : unreachableNotes(structure);
        try {
            requireValid(structure);
            return ValidationResult.ok(notes);
        } catch (CycleException e) {
            return ValidationResult.failure(e.errorType(), e.getMessage(), e.getCycle(), notes);
        } catch (GrdException e) {
            return ValidationResult.failure(e.errorType(), e.getMessage(), List.of(), notes);
        }
    }

    /**
     * Check the structure, throwing the first failure.
     *
     * @throws EmptyGraphException           no nodes
     * @throws ReferentialIntegrityException an edge names an unknown node
     * @throws NoStartNodeException          every node has an incoming edge
     * @throws CycleException                the graph has a directed cycle
     */
    public void requireValid(GrdStructure structure) {
        if (structure.isEmpty()) {
            throw new EmptyGraphException();
        }

        for (FlowEdge edge : structure.getEdges()) {
            if (!structure.containsNode(edge.fromId())) {
                throw new ReferentialIntegrityException(edge.fromId(), edge);
            }
            if (!structure.containsNode(edge.toId())) {
                throw new ReferentialIntegrityException(edge.toId(), edge);
            }
        }

        if (structure.startNodes().isEmpty()) {
            List<String> cycle = cycleDetector.findCycle(structure)
                    .orElseThrow(() -> new IllegalStateException("Graph without start node must contain a cycle"));
            throw new NoStartNodeException(structure.nodeCount(), cycle);
        }

        Optional<List<String>> cycle = cycleDetector.findCycle(structure);
        if (cycle.isPresent()) {
            throw new CycleException(cycle.get());
        }
    }

    /**
     * Nodes not reachable from any start node, in declaration order. Empty when there is no
     * start node at all, since that case is already an error.
     */
    public List<String> findUnreachable(GrdStructure structure) {
        List<String> starts = structure.startNodes();
        if (starts.isEmpty()) {
            return List.of();
        }

        Set<String> reached = new HashSet<>(starts);
        Deque<String> queue = new ArrayDeque<>(starts);
        while (!queue.isEmpty()) {
            String current = queue.poll();
            for (FlowEdge edge : structure.outgoing(current)) {
                if (reached.add(edge.toId())) {
                    queue.add(edge.toId());
                }
            }
        }

        return structure.getNodes().keySet().stream()
                .filter(id -> !reached.contains(id))
                .collect(Collectors.toList());
    }

    private List<String> unreachableNotes(GrdStructure structure) {
        List<String> unreachable = findUnreachable(structure);
        if (unreachable.isEmpty()) {
            return List.of();
        }
        log.debug("Nodes unreachable from any start node: {}", unreachable);
        return List.of("Nodes not reachable from any start node: " + String.join(", ", unreachable));
    }
}
