package com.nodeflow.vgc.codegen;

import java.util.List;
import java.util.Optional;
import java.util.Set;

import com.nodeflow.vgc.api.VisualNode;
import com.nodeflow.vgc.ast.AstTransformer;
import com.nodeflow.vgc.ast.ClassDef;
import com.nodeflow.vgc.ast.Constant;
import com.nodeflow.vgc.ast.ExprStmt;
import com.nodeflow.vgc.ast.FunctionDef;
import com.nodeflow.vgc.ast.Stmt;
import com.nodeflow.vgc.engine.VisualGraph;

/**
 * Turns the comments of a graph node into the docstring of the definition it
 * produced. An author-written docstring is kept; a synthesized one is replaced.
 */
public final class CommentPreservationPass extends AstTransformer {
    private final DefinitionMatcher matcher;
    private final Set<Stmt> synthesized;

    /**
     * @param synthesized docstring statements inserted by {@link DocstringPass},
     *                    compared by identity
     */
    public CommentPreservationPass(VisualGraph graph, Set<Stmt> synthesized) {
        this.matcher = new DefinitionMatcher(graph);
        this.synthesized = synthesized;
    }

    @Override
    protected Stmt visitFunctionDef(FunctionDef function) {
        List<Stmt> body = attach(matcher.forFunction(function.name()), function.body());
        return body == function.body() ? function : function.withBody(body);
    }

    @Override
    protected Stmt visitClassDef(ClassDef cls) {
        List<Stmt> body = attach(matcher.forClass(cls.name()), cls.body());
        return body == cls.body() ? cls : cls.withBody(body);
    }

    private List<Stmt> attach(Optional<VisualNode> source, List<Stmt> body) {
        if (source.isEmpty() || source.get().getComments().isEmpty())
            return body;
        Stmt doc = new ExprStmt(new Constant(String.join("\n", source.get().getComments())));
        if (!hasDocstring(body))
            return prepend(doc, body);
        if (synthesized.contains(body.get(0)))
            return replaceFirst(doc, body);
        return body;
    }
}
