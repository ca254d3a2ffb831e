package com.nodeflow.vgc.lowering.mapper;

import com.nodeflow.vgc.api.VisualNode;
import com.nodeflow.vgc.ast.AstNode;
import com.nodeflow.vgc.ast.Call;
import com.nodeflow.vgc.ast.Constant;
import com.nodeflow.vgc.ast.ExceptHandler;
import com.nodeflow.vgc.ast.For;
import com.nodeflow.vgc.ast.If;
import com.nodeflow.vgc.ast.Name;
import com.nodeflow.vgc.ast.Pass;
import com.nodeflow.vgc.ast.Stmt;
import com.nodeflow.vgc.ast.Try;
import com.nodeflow.vgc.ast.While;
import com.nodeflow.vgc.ast.With;
import com.nodeflow.vgc.ast.WithItem;
import com.nodeflow.vgc.lowering.ConnectionContext;
import com.nodeflow.vgc.lowering.NodeMapper;

import java.util.List;

/**
 * Lowers a control-flow node to an {@code if}, {@code for}, {@code while},
 * {@code try} or {@code with} skeleton selected by {@code control_type}.
 * Bodies are a single {@code pass}. Unknown types lower to {@code pass}.
 */
public final class ControlFlowMapper implements NodeMapper {
    private static final List<Stmt> PASS = List.of(Pass.INSTANCE);

    @Override
    public AstNode lower(VisualNode node, ConnectionContext context) {
        String type = node.stringParameter("control_type", "if");
        switch (type) {
            case "if":
                return new If(context.boundOr(node, "condition", () -> Constant.TRUE), PASS, List.of());
            case "for":
                return new For(new Name("i"),
                        context.boundOr(node, "iterable", () -> Call.of("range", Constant.of(10))),
                        PASS, List.of(), false);
            case "while":
                return new While(context.boundOr(node, "condition", () -> Constant.TRUE), PASS, List.of());
            case "try":
                String exceptionType = node.stringParameter("exception_type", "Exception");
                return new Try(PASS, List.of(new ExceptHandler(new Name(exceptionType), "e", PASS)),
                        List.of(), List.of());
            case "with":
                return new With(List.of(new WithItem(
                        context.boundOr(node, "context_manager", () -> Call.of("open", Constant.of("file.txt"))),
                        new Name("f"))), PASS, false);
            default:
                return Pass.INSTANCE;
        }
    }
}
