package com.hrflow.hrflow_backend.engine;

import com.hrflow.hrflow_backend.model.domain.WorkflowEdge;
import com.hrflow.hrflow_backend.model.domain.WorkflowNode;

import java.util.*;

/**
 * Deterministic visiting order over a workflow graph. Used for layout and naming only;
 * this is not a topological sort and cycles are allowed.
 */
public final class GraphOrderer {

    private GraphOrderer() {}

    /**
     * Depth-first order from the first root (first node without incoming edges, or the
     * first node when every node has one). Outgoing edges are followed by ascending
     * priority, ties in edge order. Nodes the traversal never reaches are appended in
     * input order.
     */
    public static List<WorkflowNode> order(List<WorkflowNode> nodes, List<WorkflowEdge> edges) {
        if (nodes == null || nodes.isEmpty()) return List.of();

        Map<Long, WorkflowNode> byId = new LinkedHashMap<>();
        nodes.forEach(n -> byId.put(n.getId(), n));
        Map<Long, List<WorkflowEdge>> outgoing = outgoing(edges);

        List<WorkflowNode> roots = roots(nodes, edges);
        WorkflowNode start = roots.isEmpty() ? nodes.get(0) : roots.get(0);

        List<WorkflowNode> order = new ArrayList<>(nodes.size());
        Set<Long> visited = new HashSet<>();
        Deque<Long> stack = new ArrayDeque<>();
        stack.push(start.getId());

        while (!stack.isEmpty()) {
            Long id = stack.pop();
            if (!visited.add(id)) continue;

            WorkflowNode node = byId.get(id);
            // Edges may point at nodes that were deleted
            if (node != null) order.add(node);

            List<WorkflowEdge> outs = outgoing.getOrDefault(id, List.of());
            for (int i = outs.size() - 1; i >= 0; i--) {
                stack.push(outs.get(i).getToNodeId());
            }
        }

        for (WorkflowNode node : nodes) {
            if (!visited.contains(node.getId())) order.add(node);
        }
        return order;
    }

    /** Nodes with no incoming edge, in input order. */
    public static List<WorkflowNode> roots(List<WorkflowNode> nodes, List<WorkflowEdge> edges) {
        Set<Long> incoming = new HashSet<>();
        if (edges != null) edges.forEach(e -> incoming.add(e.getToNodeId()));
        return nodes.stream()
                .filter(n -> !incoming.contains(n.getId()))
                .toList();
    }

    /** Outgoing edges per source node, stably sorted by priority. */
    public static Map<Long, List<WorkflowEdge>> outgoing(List<WorkflowEdge> edges) {
        Map<Long, List<WorkflowEdge>> map = new LinkedHashMap<>();
        if (edges == null) return map;
        for (WorkflowEdge edge : edges) {
            map.computeIfAbsent(edge.getFromNodeId(), k -> new ArrayList<>()).add(edge);
        }
        map.values().forEach(list -> list.sort(Comparator.comparingInt(WorkflowEdge::priorityOrDefault)));
        return map;
    }
}
