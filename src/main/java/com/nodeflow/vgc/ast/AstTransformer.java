package com.nodeflow.vgc.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * Rebuilds a statement tree bottom-up.
 *
 * <p>
 * The default implementation copies every compound statement with its nested
 * bodies transformed and returns simple statements unchanged. Subclasses
 * override {@link #visitFunctionDef} or {@link #visitClassDef} to rewrite
 * definitions; those hooks receive the definition with its body already
 * transformed. Expressions are never descended into.
 *
 * <p>
 * The input tree is never modified.
 */
public abstract class AstTransformer {

    public Module transform(Module module) {
        return new Module(transformBody(module.body()));
    }

    protected List<Stmt> transformBody(List<Stmt> body) {
        List<Stmt> out = new ArrayList<>(body.size());
        for (Stmt s : body)
            out.add(transformStmt(s));
        return out;
    }

    protected Stmt transformStmt(Stmt stmt) {
        if (stmt instanceof FunctionDef f)
            return visitFunctionDef(f.withBody(transformBody(f.body())));
        if (stmt instanceof ClassDef c)
            return visitClassDef(c.withBody(transformBody(c.body())));
        if (stmt instanceof If s)
            return new If(s.test(), transformBody(s.body()), transformBody(s.orelse()));
        if (stmt instanceof For s)
            return new For(s.target(), s.iter(), transformBody(s.body()), transformBody(s.orelse()), s.isAsync());
        if (stmt instanceof While s)
            return new While(s.test(), transformBody(s.body()), transformBody(s.orelse()));
        if (stmt instanceof With s)
            return new With(s.items(), transformBody(s.body()), s.isAsync());
        if (stmt instanceof Try s) {
            List<ExceptHandler> handlers = new ArrayList<>(s.handlers().size());
            for (ExceptHandler h : s.handlers())
                handlers.add(new ExceptHandler(h.type(), h.name(), transformBody(h.body())));
            return new Try(transformBody(s.body()), handlers, transformBody(s.orelse()),
                    transformBody(s.finalbody()));
        }
        return stmt;
    }

    protected Stmt visitFunctionDef(FunctionDef function) {
        return function;
    }

    protected Stmt visitClassDef(ClassDef cls) {
        return cls;
    }

    // ── Docstring helpers shared by the passes ─────────────────────

    /** True if the first statement of {@code body} is a string literal. */
    public static boolean hasDocstring(List<Stmt> body) {
        return !body.isEmpty() && body.get(0) instanceof ExprStmt e && e.isStringLiteral();
    }

    /** Returns {@code body} with {@code docstring} inserted at the front. */
    public static List<Stmt> prepend(Stmt docstring, List<Stmt> body) {
        List<Stmt> out = new ArrayList<>(body.size() + 1);
        out.add(docstring);
        out.addAll(body);
        return out;
    }

    /** Returns {@code body} with its first statement replaced by {@code docstring}. */
    public static List<Stmt> replaceFirst(Stmt docstring, List<Stmt> body) {
        List<Stmt> out = new ArrayList<>(body);
        out.set(0, docstring);
        return out;
    }
}
