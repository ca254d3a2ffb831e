package com.nodeflow.vgc.lowering;

import com.nodeflow.vgc.api.Connection;
import com.nodeflow.vgc.api.NodeKind;
import com.nodeflow.vgc.api.VisualNode;
import com.nodeflow.vgc.ast.Expr;
import com.nodeflow.vgc.ast.Name;
import com.nodeflow.vgc.engine.VisualGraph;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Expressions bound to node inputs by the graph's connections, keyed
 * {@code "<targetId>.<targetPort>"}.
 *
 * <p>
 * A connection from a variable node binds the variable's name. Any other
 * source binds the placeholder {@code output_<id8>}, which the emitted
 * program never defines. When several connections target the same input
 * the last one wins.
 */
public final class ConnectionContext {
    public static final ConnectionContext EMPTY = new ConnectionContext(Map.of());

    private final Map<String, Expr> bindings;

    private ConnectionContext(Map<String, Expr> bindings) {
        this.bindings = bindings;
    }

    public static ConnectionContext of(VisualGraph graph) {
        Map<String, Expr> bindings = new LinkedHashMap<>();
        for (Connection c : graph.connections()) {
            Optional<VisualNode> source = graph.node(c.sourceNodeId());
            if (source.isEmpty())
                continue;
            bindings.put(c.targetKey(), referenceTo(source.get()));
        }
        return new ConnectionContext(Collections.unmodifiableMap(bindings));
    }

    /** Name by which the lowered program refers to {@code node}'s value. */
    public static Name referenceTo(VisualNode node) {
        if (node.getKind() == NodeKind.VARIABLE)
            return new Name(variableName(node));
        return new Name("output_" + node.shortId());
    }

    public static String variableName(VisualNode node) {
        return node.stringParameter("variable_name", "var_" + node.shortId());
    }

    public static String key(UUID nodeId, String port) {
        return nodeId + "." + port;
    }

    public Optional<Expr> bound(VisualNode node, String port) {
        return Optional.ofNullable(bindings.get(key(node.getId(), port)));
    }

    /** The bound expression, or the supplied placeholder when the input is unbound. */
    public Expr boundOr(VisualNode node, String port, Supplier<Expr> placeholder) {
        Expr e = bindings.get(key(node.getId(), port));
        return e != null ? e : placeholder.get();
    }

    public Map<String, Expr> bindings() {
        return bindings;
    }

    public int size() {
        return bindings.size();
    }
}
