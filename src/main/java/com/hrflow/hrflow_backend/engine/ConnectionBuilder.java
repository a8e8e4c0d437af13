package com.hrflow.hrflow_backend.engine;

import com.hrflow.hrflow_backend.compiler.NodeNames;
import com.hrflow.hrflow_backend.model.compiled.ConnectionMap;
import com.hrflow.hrflow_backend.model.domain.NodeKind;
import com.hrflow.hrflow_backend.model.domain.WorkflowEdge;
import com.hrflow.hrflow_backend.model.domain.WorkflowNode;

import java.util.*;

/**
 * Turns workflow edges into the engine connection map.
 *
 * <p>Condition nodes use two ports: 0 for the true branch and 1 for the false branch.
 * The branch is read from the edge label ("true"/"false" substrings, case-insensitive).
 * When none of a condition's edges has such a label the first edge goes to port 0 and
 * the second to port 1. Every other node sends all edges through port 0.
 */
public final class ConnectionBuilder {

    private static final int TRUE_PORT = 0;
    private static final int FALSE_PORT = 1;

    private ConnectionBuilder() {}

    public static ConnectionMap connect(List<WorkflowNode> nodes,
                                        List<WorkflowEdge> edges,
                                        List<WorkflowNode> ordered,
                                        String entryName) {
        ConnectionMap connections = new ConnectionMap();

        List<WorkflowNode> roots = GraphOrderer.roots(nodes, edges);
        List<WorkflowNode> entryTargets = roots.isEmpty() && !ordered.isEmpty()
                ? List.of(ordered.get(0))
                : roots;
        for (WorkflowNode root : entryTargets) {
            connections.connect(entryName, NodeNames.stableName(root), 0);
        }

        Map<Long, WorkflowNode> byId = new HashMap<>();
        nodes.forEach(n -> byId.put(n.getId(), n));
        Map<Long, List<WorkflowEdge>> outgoing = GraphOrderer.outgoing(edges);

        for (WorkflowNode node : nodes) {
            List<WorkflowEdge> outs = outgoing.getOrDefault(node.getId(), List.of());
            if (outs.isEmpty()) continue;

            if (node.getNodeKind() == NodeKind.CONDITION) {
                connectCondition(node, outs, byId, connections);
                continue;
            }

            String fromName = NodeNames.stableName(node);
            for (WorkflowEdge edge : outs) {
                WorkflowNode to = byId.get(edge.getToNodeId());
                if (to != null) connections.connect(fromName, NodeNames.stableName(to), 0);
            }
        }
        return connections;
    }

    private static void connectCondition(WorkflowNode from,
                                         List<WorkflowEdge> outs,
                                         Map<Long, WorkflowNode> byId,
                                         ConnectionMap connections) {
        String fromName = NodeNames.stableName(from);

        List<WorkflowEdge> trueEdges = outs.stream().filter(e -> labelContains(e, "true")).toList();
        List<WorkflowEdge> falseEdges = outs.stream().filter(e -> labelContains(e, "false")).toList();

        if (trueEdges.isEmpty() && falseEdges.isEmpty()) {
            // Positional fallback for labels like "Approved" / "Rejected"
            for (int i = 0; i < outs.size(); i++) {
                WorkflowNode to = byId.get(outs.get(i).getToNodeId());
                if (to == null) continue;
                connections.connect(fromName, NodeNames.stableName(to), i == 1 ? FALSE_PORT : TRUE_PORT);
            }
            return;
        }

        for (WorkflowEdge edge : trueEdges) {
            connectTo(fromName, edge, byId, connections, TRUE_PORT);
        }
        for (WorkflowEdge edge : falseEdges) {
            connectTo(fromName, edge, byId, connections, FALSE_PORT);
        }

        Set<WorkflowEdge> used = Collections.newSetFromMap(new IdentityHashMap<>());
        used.addAll(trueEdges);
        used.addAll(falseEdges);
        for (WorkflowEdge edge : outs) {
            if (!used.contains(edge)) connectTo(fromName, edge, byId, connections, TRUE_PORT);
        }
    }

    private static void connectTo(String fromName, WorkflowEdge edge, Map<Long, WorkflowNode> byId,
                                  ConnectionMap connections, int port) {
        WorkflowNode to = byId.get(edge.getToNodeId());
        if (to != null) connections.connect(fromName, NodeNames.stableName(to), port);
    }

    private static boolean labelContains(WorkflowEdge edge, String word) {
        return edge.getLabel() != null && edge.getLabel().toLowerCase(Locale.ROOT).contains(word);
    }
}
