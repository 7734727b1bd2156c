package com.braid.reasoning.service.graph;

import com.braid.reasoning.model.FlowEdge;
import com.braid.reasoning.model.GrdStructure;
import org.springframework.stereotype.Service;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Finds a directed cycle with a depth-first walk that tracks the nodes currently on the stack.
 *
 * Roots and neighbours are visited in declaration order, so the same diagram always reports the
 * same cycle. The walk uses an explicit stack; deep chains cannot overflow the call stack.
 */
@Service
public class CycleDetector {

    /**
     * @return the first cycle found, closed (first element repeated at the end), e.g. [A, B, A];
     *         empty when the graph is acyclic
     */
    public Optional<List<String>> findCycle(GrdStructure structure) {
        Set<String> visited = new HashSet<>();

        for (String root : structure.getNodes().keySet()) {
            if (visited.contains(root)) continue;

            Optional<List<String>> cycle = walk(structure, root, visited);
            if (cycle.isPresent()) {
                return cycle;
            }
        }
        return Optional.empty();
    }

    public boolean hasCycle(GrdStructure structure) {
        return findCycle(structure).isPresent();
    }

    private Optional<List<String>> walk(GrdStructure structure, String root, Set<String> visited) {
        Deque<Frame> stack = new ArrayDeque<>();
        List<String> path = new ArrayList<>();
        Set<String> onStack = new HashSet<>();

        stack.push(new Frame(root));
        path.add(root);
        onStack.add(root);
        visited.add(root);

        while (!stack.isEmpty()) {
            Frame frame = stack.peek();
            List<FlowEdge> out = structure.outgoing(frame.node);

            if (frame.next == out.size()) {
                stack.pop();
                path.remove(path.size() - 1);
                onStack.remove(frame.node);
                continue;
            }

            String neighbor = out.get(frame.next++).toId();
            if (onStack.contains(neighbor)) {
                // back edge: the cycle is the path suffix starting at neighbor
                List<String> cycle = new ArrayList<>(path.subList(path.indexOf(neighbor), path.size()));
                cycle.add(neighbor);
                return Optional.of(cycle);
            }
            if (visited.add(neighbor)) {
                stack.push(new Frame(neighbor));
                path.add(neighbor);
                onStack.add(neighbor);
            }
        }
        return Optional.empty();
    }

    private static final class Frame {
        private final String node;
        private int next;

        Frame(String node) {
            this.node = node;
        }
    }
}
