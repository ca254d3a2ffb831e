package com.nodeflow.vgc.lowering.mapper;

import com.nodeflow.vgc.api.VisualNode;
import com.nodeflow.vgc.ast.Arg;
import com.nodeflow.vgc.ast.Arguments;
import com.nodeflow.vgc.ast.AstNode;
import com.nodeflow.vgc.ast.Attribute;
import com.nodeflow.vgc.ast.Call;
import com.nodeflow.vgc.ast.Expr;
import com.nodeflow.vgc.ast.FunctionDef;
import com.nodeflow.vgc.ast.Keyword;
import com.nodeflow.vgc.ast.Name;
import com.nodeflow.vgc.ast.Pass;
import com.nodeflow.vgc.ast.Return;
import com.nodeflow.vgc.ast.Starred;
import com.nodeflow.vgc.lowering.ConnectionContext;
import com.nodeflow.vgc.lowering.NodeMapper;

import java.util.List;

/**
 * Lowers a decorator node, selected by {@code decorator_type}:
 * {@code reference} yields the decorator expression itself,
 * {@code decorated_function} an empty function carrying the decorator and
 * {@code decorator_definition} a pass-through wrapper definition.
 */
public final class DecoratorMapper implements NodeMapper {

    @Override
    public AstNode lower(VisualNode node, ConnectionContext context) {
        String decoratorName = node.stringParameter("decorator_name", "decorator");
        switch (node.stringParameter("decorator_type", "reference")) {
            case "decorated_function":
                return FunctionDef.of(node.stringParameter("function_name", "decorated_function"), Arguments.EMPTY,
                        Pass.INSTANCE).withDecorators(List.of(reference(decoratorName)));
            case "decorator_definition":
                return definition(decoratorName);
            default:
                return reference(decoratorName);
        }
    }

    /** {@code name} or a dotted attribute chain such as {@code property.setter}. */
    private static Expr reference(String decoratorName) {
        return decoratorName.indexOf('.') >= 0 ? Attribute.dotted(decoratorName) : new Name(decoratorName);
    }

    /** Defines the last segment of a dotted name: {@code cache.timed} defines {@code timed}. */
    private static FunctionDef definition(String decoratorName) {
        String last = decoratorName.substring(decoratorName.lastIndexOf('.') + 1);
        String name = last.isEmpty() ? "decorator" : last;
        Arguments varargs = new Arguments(List.of(), Arg.of("args"), List.of(), Arg.of("kwargs"));
        Call forward = new Call(new Name("func"), List.of(new Starred(new Name("args"))),
                List.of(new Keyword(null, new Name("kwargs"))));
        FunctionDef wrapper = FunctionDef.of("wrapper", varargs, new Return(forward));
        return FunctionDef.of(name, Arguments.of("func"), wrapper, new Return(new Name("wrapper")));
    }
}
