package com.nodeflow.vgc.lowering;

import com.nodeflow.vgc.api.LoweringListener;
import com.nodeflow.vgc.api.VisualNode;
import com.nodeflow.vgc.ast.AstNode;
import com.nodeflow.vgc.ast.Comment;
import com.nodeflow.vgc.ast.Expr;
import com.nodeflow.vgc.ast.ExprStmt;
import com.nodeflow.vgc.ast.Module;
import com.nodeflow.vgc.ast.Stmt;
import com.nodeflow.vgc.engine.VisualGraph;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Lowers a {@link VisualGraph} to a {@link Module}, one top-level statement
 * per node.
 *
 * <p>
 * Nodes are visited in execution order. A graph that cannot be ordered
 * (it has a cycle) is lowered in insertion order instead. Lowering never
 * fails as a whole: a node whose kind has no mapper, or whose mapper throws,
 * becomes a comment statement.
 */
public final class GraphLowering {
    private static final Logger log = LogManager.getLogger(GraphLowering.class);

    private final MapperRegistry registry;
    private LoweringListener listener;

    public GraphLowering() {
        this(new MapperRegistry());
    }

    public GraphLowering(MapperRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    public void setListener(LoweringListener listener) {
        this.listener = listener;
    }

    public MapperRegistry registry() {
        return registry;
    }

    public Module lower(VisualGraph graph) {
        List<UUID> order = graph.executionOrder();
        if (order.isEmpty() && graph.nodeCount() > 0) {
            log.warn("Graph with {} nodes has no execution order (cycle?), lowering in insertion order",
                    graph.nodeCount());
            order = new ArrayList<>(graph.nodeCount());
            for (VisualNode n : graph.nodes())
                order.add(n.getId());
        }

        ConnectionContext context = ConnectionContext.of(graph);
        List<Stmt> body = new ArrayList<>(order.size());
        int index = 0;
        for (UUID id : order) {
            VisualNode node = graph.node(id).orElseThrow();
            body.add(lowerNode(index++, node, context));
        }
        log.debug("Lowered {} nodes with {} bound inputs", body.size(), context.size());
        return new Module(body);
    }

    private Stmt lowerNode(int index, VisualNode node, ConnectionContext context) {
        Optional<NodeMapper> mapper = registry.mapperFor(node.getKind());
        if (mapper.isEmpty()) {
            log.debug("No mapper for {}", node);
            if (listener != null)
                listener.onUnsupportedNode(index, node.getId(), node.getKind());
            return new Comment("Unsupported node type: " + node.getKind().value());
        }

        try {
            Stmt stmt = toStatement(mapper.get().lower(node, context));
            if (listener != null)
                listener.onNodeLowered(index, node.getId(), stmt.kind());
            return stmt;
        } catch (RuntimeException e) {
            log.warn("Error converting node {}: {}", node.getId(), e.toString());
            if (listener != null)
                listener.onNodeError(index, node.getId(), e);
            return new Comment("Error converting node " + node.getId() + ": " + e.getMessage());
        }
    }

    private static Stmt toStatement(AstNode lowered) {
        if (lowered instanceof Stmt s)
            return s;
        if (lowered instanceof Expr e)
            return new ExprStmt(e);
        throw new IllegalStateException("Mapper produced neither a statement nor an expression: "
                + (lowered == null ? "null" : lowered.kind()));
    }
}
