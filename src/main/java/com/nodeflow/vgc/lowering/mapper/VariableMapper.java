package com.nodeflow.vgc.lowering.mapper;

import com.nodeflow.vgc.api.VisualNode;
import com.nodeflow.vgc.ast.Assign;
import com.nodeflow.vgc.ast.AstNode;
import com.nodeflow.vgc.lowering.ConnectionContext;
import com.nodeflow.vgc.lowering.Literals;
import com.nodeflow.vgc.lowering.NodeMapper;

/**
 * Lowers a variable node to {@code name = value}, where the value comes from
 * the bound {@code value} input or else the {@code default_value} parameter
 * (0 when absent).
 */
public final class VariableMapper implements NodeMapper {

    @Override
    public AstNode lower(VisualNode node, ConnectionContext context) {
        String name = ConnectionContext.variableName(node);
        return Assign.of(name, context.boundOr(node, "value", () -> Literals.toExpr(defaultValue(node))));
    }

    private static Object defaultValue(VisualNode node) {
        return node.getParameters().containsKey("default_value") ? node.parameter("default_value") : 0L;
    }
}
