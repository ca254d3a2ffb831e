package com.nodeflow.vgc.lifting;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

import com.nodeflow.vgc.api.NodeKind;
import com.nodeflow.vgc.api.VisualNode;
import com.nodeflow.vgc.ast.Assign;
import com.nodeflow.vgc.ast.Call;
import com.nodeflow.vgc.ast.Constant;
import com.nodeflow.vgc.ast.ExprStmt;
import com.nodeflow.vgc.ast.For;
import com.nodeflow.vgc.ast.If;
import com.nodeflow.vgc.ast.Module;
import com.nodeflow.vgc.ast.Name;
import com.nodeflow.vgc.ast.Stmt;
import com.nodeflow.vgc.ast.While;
import com.nodeflow.vgc.engine.VisualGraph;
import com.nodeflow.vgc.lowering.GraphLowering;
import com.nodeflow.vgc.parse.PythonParser;

import lombok.extern.log4j.Log4j2;

/**
 * Rebuilds a partial graph from a module's top-level statements.
 *
 * <p>
 * Recognized shapes: a single-name assignment becomes a variable node, a
 * call on a plain name becomes a function node, and {@code if}/{@code for}/
 * {@code while} become control-flow nodes. Everything else, including nested
 * statements, is dropped. No connections are recovered.
 */
@Log4j2
public final class GraphLifting {
    private static final double VARIABLE_COLUMN = 100.0;
    private static final double FUNCTION_COLUMN = 200.0;
    private static final double CONTROL_COLUMN = 300.0;
    private static final double ROW_HEIGHT = 50.0;

    private final GraphLowering lowering;

    public GraphLifting() {
        this(new GraphLowering());
    }

    /** @param lowering used by {@link #validateRoundTrip} */
    public GraphLifting(GraphLowering lowering) {
        this.lowering = Objects.requireNonNull(lowering, "lowering");
    }

    public VisualGraph lift(Module module) {
        VisualGraph graph = new VisualGraph();
        List<Stmt> body = module.body();
        for (int i = 0; i < body.size(); i++)
            liftStatement(body.get(i), i).ifPresent(graph::addNode);
        log.debug("Lifted {} of {} statements", graph.nodeCount(), body.size());
        return graph;
    }

    /**
     * Parses Python source and lifts it.
     *
     * @throws com.nodeflow.vgc.parse.SourceParseException if the source does not parse
     */
    public VisualGraph liftSource(String source) {
        return lift(PythonParser.parse(source));
    }

    /**
     * Lowers {@code graph}, lifts the result and compares node counts. Any
     * failure along the way yields false.
     */
    public boolean validateRoundTrip(VisualGraph graph) {
        try {
            VisualGraph lifted = lift(lowering.lower(graph));
            return lifted.nodeCount() == graph.nodeCount();
        } catch (RuntimeException e) {
            log.debug("Round trip failed", e);
            return false;
        }
    }

    private static Optional<VisualNode> liftStatement(Stmt stmt, int index) {
        double row = ROW_HEIGHT * index;
        if (stmt instanceof Assign a && a.singleName() != null) {
            VisualNode.VisualNodeBuilder b = VisualNode.builder()
                    .kind(NodeKind.VARIABLE)
                    .position(new VisualNode.Position(VARIABLE_COLUMN, row))
                    .parameter("variable_name", a.singleName());
            if (a.value() instanceof Constant c && c.value() != null)
                b.parameter("default_value", c.value());
            return Optional.of(b.build());
        }
        if (stmt instanceof ExprStmt e && e.value() instanceof Call c && c.func() instanceof Name n) {
            return Optional.of(VisualNode.builder()
                    .kind(NodeKind.FUNCTION)
                    .position(new VisualNode.Position(FUNCTION_COLUMN, row))
                    .parameter("function_name", n.id())
                    .build());
        }
        String controlType = null;
        if (stmt instanceof If)
            controlType = "if";
        else if (stmt instanceof For f && !f.isAsync())
            controlType = "for";
        else if (stmt instanceof While)
            controlType = "while";
        if (controlType != null) {
            return Optional.of(VisualNode.builder()
                    .kind(NodeKind.CONTROL_FLOW)
                    .position(new VisualNode.Position(CONTROL_COLUMN, row))
                    .parameter("control_type", controlType)
                    .build());
        }
        return Optional.empty();
    }
}
