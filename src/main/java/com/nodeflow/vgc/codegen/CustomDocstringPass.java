package com.nodeflow.vgc.codegen;

import java.util.List;
import java.util.Optional;

import com.nodeflow.vgc.api.VisualNode;
import com.nodeflow.vgc.ast.AstTransformer;
import com.nodeflow.vgc.ast.ClassDef;
import com.nodeflow.vgc.ast.Constant;
import com.nodeflow.vgc.ast.ExprStmt;
import com.nodeflow.vgc.ast.FunctionDef;
import com.nodeflow.vgc.ast.Stmt;
import com.nodeflow.vgc.engine.VisualGraph;

/**
 * Replaces a definition's docstring with the explicit docstring of the graph
 * node it came from, whatever was there before.
 */
public final class CustomDocstringPass extends AstTransformer {
    private final DefinitionMatcher matcher;

    public CustomDocstringPass(VisualGraph graph) {
        this.matcher = new DefinitionMatcher(graph);
    }

    @Override
    protected Stmt visitFunctionDef(FunctionDef function) {
        List<Stmt> body = override(matcher.forFunction(function.name()), function.body());
        return body == function.body() ? function : function.withBody(body);
    }

    @Override
    protected Stmt visitClassDef(ClassDef cls) {
        List<Stmt> body = override(matcher.forClass(cls.name()), cls.body());
        return body == cls.body() ? cls : cls.withBody(body);
    }

    private static List<Stmt> override(Optional<VisualNode> source, List<Stmt> body) {
        Optional<String> text = source.flatMap(VisualNode::docstringIfPresent);
        if (text.isEmpty())
            return body;
        Stmt doc = new ExprStmt(new Constant(text.get()));
        return hasDocstring(body) ? replaceFirst(doc, body) : prepend(doc, body);
    }
}
