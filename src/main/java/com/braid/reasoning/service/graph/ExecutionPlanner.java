package com.braid.reasoning.service.graph;

import com.braid.reasoning.exception.CycleException;
import com.braid.reasoning.exception.EmptyGraphException;
import com.braid.reasoning.model.ExecutionStep;
import com.braid.reasoning.model.FlowEdge;
import com.braid.reasoning.model.GrdStructure;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;
import java.util.Set;

/**
 * Derives the execution order of a GRD and the step-by-step plan.
 *
 * Ordering is Kahn's algorithm; when several nodes become ready at once, the one declared first
 * in the source goes first. The same diagram therefore always yields the same step numbers.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ExecutionPlanner {

    private final CycleDetector cycleDetector;

    /**
     * Topological order over all nodes.
     *
     * @throws EmptyGraphException if the graph has no nodes
     * @throws CycleException      if a cycle prevents a complete order; no partial order is returned
     */
    public List<String> order(GrdStructure structure) {
        if (structure.isEmpty()) {
            throw new EmptyGraphException();
        }

        List<String> order = partialOrder(structure);
        if (order.size() < structure.nodeCount()) {
            List<String> cycle = cycleDetector.findCycle(structure)
                    .orElseThrow(() -> new IllegalStateException("Ordering stalled without a cycle"));
            log.debug("Ordering stalled after {} of {} nodes, cycle {}", order.size(), structure.nodeCount(), cycle);
            throw new CycleException(cycle);
        }

        log.debug("Execution order: {}", order);
        return order;
    }

    /**
     * The prefix of the order that Kahn's algorithm can place. Nodes on or behind a cycle are
     * left out; for an acyclic graph this is the full order.
     */
    public List<String> partialOrder(GrdStructure structure) {
        Map<String, Integer> remaining = new HashMap<>();
        PriorityQueue<String> ready = new PriorityQueue<>(
                Comparator.comparingInt(structure::declarationIndex));

        for (String id : structure.getNodes().keySet()) {
            int inDegree = structure.inDegree(id);
            remaining.put(id, inDegree);
            if (inDegree == 0) {
                ready.add(id);
            }
        }

        List<String> order = new ArrayList<>(structure.nodeCount());
        while (!ready.isEmpty()) {
            String current = ready.poll();
            order.add(current);
            // parallel edges each count toward in-degree
            for (FlowEdge edge : structure.outgoing(current)) {
                int left = remaining.merge(edge.toId(), -1, Integer::sum);
                if (left == 0) {
                    ready.add(edge.toId());
                }
            }
        }
        return order;
    }

    /**
     * Zip an order with node labels and each node's direct predecessors.
     *
     * @throws IllegalArgumentException if {@code order} is not a permutation of the graph's nodes
     */
    public List<ExecutionStep> toSteps(GrdStructure structure, List<String> order) {
        if (order.size() != structure.nodeCount()) {
            throw new IllegalArgumentException(String.format(
                    "Order has %d entries but the graph has %d nodes", order.size(), structure.nodeCount()));
        }

        Set<String> seen = new HashSet<>();
        List<ExecutionStep> steps = new ArrayList<>(order.size());
        for (int i = 0; i < order.size(); i++) {
            String id = order.get(i);
            if (!structure.containsNode(id) || !seen.add(id)) {
                throw new IllegalArgumentException("Order entry '" + id + "' is unknown or repeated");
            }
            steps.add(new ExecutionStep(id, i + 1, structure.node(id).label(), structure.predecessors(id)));
        }
        return steps;
    }

    /**
     * {@link #order} followed by {@link #toSteps}.
     */
    public List<ExecutionStep> plan(GrdStructure structure) {
        return toSteps(structure, order(structure));
    }
}
