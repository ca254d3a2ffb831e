package com.nodeflow.vgc.lowering.mapper;

import com.nodeflow.vgc.api.Port;
import com.nodeflow.vgc.api.VisualNode;
import com.nodeflow.vgc.ast.AstNode;
import com.nodeflow.vgc.ast.Call;
import com.nodeflow.vgc.ast.Expr;
import com.nodeflow.vgc.ast.Keyword;
import com.nodeflow.vgc.ast.ListExpr;
import com.nodeflow.vgc.ast.Name;
import com.nodeflow.vgc.ast.TupleExpr;
import com.nodeflow.vgc.lowering.ConnectionContext;
import com.nodeflow.vgc.lowering.Literals;
import com.nodeflow.vgc.lowering.NodeMapper;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Lowers a function node to a call of {@code function_name}.
 *
 * <p>
 * A bound {@code args} input supplies positional arguments; a bound list or
 * tuple literal is spread into several. Every other bound input becomes a
 * keyword argument named after the port. Unbound inputs with a default value
 * pass that default as a keyword.
 */
public final class FunctionMapper implements NodeMapper {
    public static final String POSITIONAL_PORT = "args";

    @Override
    public AstNode lower(VisualNode node, ConnectionContext context) {
        String functionName = node.stringParameter("function_name", "unknown_function");
        List<Expr> args = new ArrayList<>();
        List<Keyword> keywords = new ArrayList<>();

        for (Port input : node.getInputs()) {
            Optional<Expr> bound = context.bound(node, input.name());
            if (bound.isPresent()) {
                Expr value = bound.get();
                if (POSITIONAL_PORT.equals(input.name())) {
                    if (value instanceof ListExpr l)
                        args.addAll(l.elts());
                    else if (value instanceof TupleExpr t)
                        args.addAll(t.elts());
                    else
                        args.add(value);
                } else {
                    keywords.add(new Keyword(input.name(), value));
                }
            } else if (input.defaultValue() != null) {
                keywords.add(new Keyword(input.name(), Literals.toExpr(input.defaultValue())));
            }
        }
        return new Call(new Name(functionName), args, keywords);
    }
}
