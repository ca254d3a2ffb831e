package com.nodeflow.vgc.lowering.mapper;

import com.nodeflow.vgc.api.VisualNode;
import com.nodeflow.vgc.ast.Arguments;
import com.nodeflow.vgc.ast.AstNode;
import com.nodeflow.vgc.ast.Call;
import com.nodeflow.vgc.ast.ClassDef;
import com.nodeflow.vgc.ast.Comprehension;
import com.nodeflow.vgc.ast.Constant;
import com.nodeflow.vgc.ast.ExprStmt;
import com.nodeflow.vgc.ast.FunctionDef;
import com.nodeflow.vgc.ast.ListComp;
import com.nodeflow.vgc.ast.Name;
import com.nodeflow.vgc.ast.Pass;
import com.nodeflow.vgc.ast.Raise;
import com.nodeflow.vgc.ast.Return;
import com.nodeflow.vgc.ast.Yield;
import com.nodeflow.vgc.ast.YieldFrom;
import com.nodeflow.vgc.lowering.ConnectionContext;
import com.nodeflow.vgc.lowering.NodeMapper;

import java.util.List;

/** Lowers a generator node, selected by {@code generator_type}. */
public final class GeneratorMapper implements NodeMapper {

    @Override
    public AstNode lower(VisualNode node, ConnectionContext context) {
        switch (node.stringParameter("generator_type", "yield")) {
            case "yield":
                return new Yield(context.boundOr(node, "value", () -> Constant.NONE));
            case "yield_from":
                return new YieldFrom(context.boundOr(node, "iterable", () -> new Name("iterable")));
            case "generator_function":
                return FunctionDef.of(node.stringParameter("function_name", "generator_function"), Arguments.EMPTY,
                        new ExprStmt(new Yield(Constant.of(1))));
            case "list_comprehension":
                return new ListComp(new Name("x"), List.of(new Comprehension(new Name("x"),
                        context.boundOr(node, "iterable", () -> new Name("iterable")), List.of(), false)));
            case "iterator_protocol":
                return iteratorClass(node.stringParameter("class_name", "Iterator"));
            default:
                return Pass.INSTANCE;
        }
    }

    private static ClassDef iteratorClass(String className) {
        FunctionDef iter = FunctionDef.of("__iter__", Arguments.of("self"), new Return(new Name("self")));
        FunctionDef next = FunctionDef.of("__next__", Arguments.of("self"),
                new Raise(Call.of("StopIteration"), null));
        return ClassDef.of(className, List.of(), iter, next);
    }
}
