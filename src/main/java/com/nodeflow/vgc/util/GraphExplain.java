package com.nodeflow.vgc.util;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import com.nodeflow.vgc.api.Connection;
import com.nodeflow.vgc.api.VisualNode;
import com.nodeflow.vgc.engine.VisualGraph;

/**
 * Diagnostic utility for inspecting graph topology.
 *
 * <p>
 * Generates human-readable string representations of the graph structure.
 * Intended for debugging sessions and error logs; allocates freely.
 */
public final class GraphExplain {
    private final VisualGraph graph;

    public GraphExplain(VisualGraph graph) {
        this.graph = graph;
    }

    /**
     * Dumps every node, in execution order (insertion order when the graph
     * has a cycle), with the nodes it feeds.
     */
    public String dumpTopology() {
        StringBuilder sb = new StringBuilder(1024);
        List<UUID> order = displayOrder();
        boolean ordered = !graph.executionOrder().isEmpty() || graph.nodeCount() == 0;
        sb.append("Graph (").append(graph.nodeCount()).append(" nodes, ")
                .append(graph.connections().size()).append(" connections")
                .append(ordered ? "" : ", UNORDERABLE").append("):\n");
        for (int i = 0; i < order.size(); i++) {
            VisualNode node = graph.node(order.get(i)).orElseThrow();
            sb.append("  [").append(i).append("] ").append(node);
            if (graph.incoming(node.getId()).isEmpty())
                sb.append(" (SRC)");
            List<Connection> out = graph.outgoing(node.getId());
            if (!out.isEmpty()) {
                sb.append(" -> ");
                for (int j = 0; j < out.size(); j++) {
                    Connection c = out.get(j);
                    sb.append(label(c.targetNodeId())).append('.').append(c.targetPort());
                    if (j < out.size() - 1)
                        sb.append(", ");
                }
            }
            sb.append('\n');
        }
        return sb.toString();
    }

    /**
     * Generates a Mermaid JS graph diagram: one box per node labelled with its
     * kind and name, one edge per connection labelled with its ports.
     */
    public String toMermaid() {
        StringBuilder sb = new StringBuilder(4096);
        sb.append("graph TD;\n");

        // 1. Declare nodes in display order
        for (UUID id : displayOrder()) {
            VisualNode node = graph.node(id).orElseThrow();
            sb.append("  ").append(mermaidId(id)).append("[\"").append(node.getKind().value());
            String title = title(node);
            if (!title.isEmpty())
                sb.append(": ").append(escape(title));
            sb.append("\"];\n");
        }

        // 2. Declare all edges afterwards
        for (Connection c : graph.connections()) {
            if (!graph.containsNode(c.sourceNodeId()) || !graph.containsNode(c.targetNodeId()))
                continue;
            sb.append("  ").append(mermaidId(c.sourceNodeId()))
                    .append(" -- \"").append(escape(c.sourcePort() + " -> " + c.targetPort())).append("\" --> ")
                    .append(mermaidId(c.targetNodeId())).append(";\n");
        }
        return sb.toString();
    }

    private List<UUID> displayOrder() {
        List<UUID> order = graph.executionOrder();
        if (!order.isEmpty() || graph.nodeCount() == 0)
            return order;
        List<UUID> insertion = new ArrayList<>(graph.nodeCount());
        for (VisualNode n : graph.nodes())
            insertion.add(n.getId());
        return insertion;
    }

    private String label(UUID id) {
        return graph.node(id).map(VisualNode::toString).orElse(id.toString());
    }

    private static String title(VisualNode node) {
        for (String key : new String[] { "variable_name", "function_name", "class_name", "control_type" }) {
            Object v = node.parameter(key);
            if (v != null)
                return v.toString();
        }
        return node.getName();
    }

    private static String mermaidId(UUID id) {
        return "n" + id.toString().replace("-", "").substring(0, 12);
    }

    private static String escape(String text) {
        return text.replace("\"", "#quot;").replace(">", "#gt;");
    }
}
