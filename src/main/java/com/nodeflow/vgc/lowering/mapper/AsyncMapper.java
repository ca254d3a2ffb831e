package com.nodeflow.vgc.lowering.mapper;

import com.nodeflow.vgc.api.VisualNode;
import com.nodeflow.vgc.ast.Arguments;
import com.nodeflow.vgc.ast.AstNode;
import com.nodeflow.vgc.ast.Await;
import com.nodeflow.vgc.ast.Call;
import com.nodeflow.vgc.ast.For;
import com.nodeflow.vgc.ast.FunctionDef;
import com.nodeflow.vgc.ast.Name;
import com.nodeflow.vgc.ast.Pass;
import com.nodeflow.vgc.ast.Stmt;
import com.nodeflow.vgc.ast.With;
import com.nodeflow.vgc.ast.WithItem;
import com.nodeflow.vgc.lowering.ConnectionContext;
import com.nodeflow.vgc.lowering.NodeMapper;

import java.util.List;

/** Lowers an async node, selected by {@code async_type}. */
public final class AsyncMapper implements NodeMapper {
    private static final List<Stmt> PASS = List.of(Pass.INSTANCE);

    @Override
    public AstNode lower(VisualNode node, ConnectionContext context) {
        switch (node.stringParameter("async_type", "await")) {
            case "await":
                return new Await(context.boundOr(node, "awaitable", () -> Call.of("async_function")));
            case "async_function":
                return new FunctionDef(node.stringParameter("function_name", "async_function"), Arguments.EMPTY,
                        PASS, List.of(), null, true);
            case "async_for":
                return new For(new Name("item"),
                        context.boundOr(node, "async_iterable", () -> new Name("async_iterable")),
                        PASS, List.of(), true);
            case "async_with":
                return new With(List.of(new WithItem(
                        context.boundOr(node, "async_context_manager", () -> new Name("async_context_manager")),
                        new Name("ctx"))), PASS, true);
            default:
                return Pass.INSTANCE;
        }
    }
}
