package com.nodeflow.vgc.ast;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.function.Predicate;

/**
 * Pre-order traversal over statements and expressions alike.
 */
public final class AstWalker {

    private AstWalker() {
    }

    /** Every node reachable from {@code root}, root first, in source order. */
    public static List<AstNode> walk(AstNode root) {
        List<AstNode> out = new ArrayList<>();
        Deque<AstNode> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            AstNode node = stack.pop();
            out.add(node);
            List<AstNode> children = children(node);
            for (int i = children.size() - 1; i >= 0; i--)
                stack.push(children.get(i));
        }
        return out;
    }

    public static boolean anyMatch(AstNode root, Predicate<AstNode> predicate) {
        for (AstNode n : walk(root))
            if (predicate.test(n))
                return true;
        return false;
    }

    /** Direct children in source order. Null slots are skipped. */
    public static List<AstNode> children(AstNode node) {
        List<AstNode> c = new ArrayList<>();
        if (node instanceof Module m) {
            c.addAll(m.body());
        } else if (node instanceof FunctionDef f) {
            c.addAll(f.decorators());
            c.add(f.args());
            add(c, f.returns());
            c.addAll(f.body());
        } else if (node instanceof ClassDef k) {
            c.addAll(k.decorators());
            c.addAll(k.bases());
            c.addAll(k.keywords());
            c.addAll(k.body());
        } else if (node instanceof Arguments a) {
            c.addAll(a.args());
            add(c, a.vararg());
            c.addAll(a.kwonlyargs());
            add(c, a.kwarg());
        } else if (node instanceof Arg a) {
            add(c, a.annotation());
            add(c, a.defaultValue());
        } else if (node instanceof Assign s) {
            c.addAll(s.targets());
            c.add(s.value());
        } else if (node instanceof AugAssign s) {
            c.add(s.target());
            c.add(s.value());
        } else if (node instanceof AnnAssign s) {
            c.add(s.target());
            c.add(s.annotation());
            add(c, s.value());
        } else if (node instanceof ExprStmt s) {
            c.add(s.value());
        } else if (node instanceof If s) {
            c.add(s.test());
            c.addAll(s.body());
            c.addAll(s.orelse());
        } else if (node instanceof For s) {
            c.add(s.target());
            c.add(s.iter());
            c.addAll(s.body());
            c.addAll(s.orelse());
        } else if (node instanceof While s) {
            c.add(s.test());
            c.addAll(s.body());
            c.addAll(s.orelse());
        } else if (node instanceof Try s) {
            c.addAll(s.body());
            c.addAll(s.handlers());
            c.addAll(s.orelse());
            c.addAll(s.finalbody());
        } else if (node instanceof ExceptHandler h) {
            add(c, h.type());
            c.addAll(h.body());
        } else if (node instanceof With s) {
            c.addAll(s.items());
            c.addAll(s.body());
        } else if (node instanceof WithItem w) {
            c.add(w.contextExpr());
            add(c, w.optionalVars());
        } else if (node instanceof Return s) {
            add(c, s.value());
        } else if (node instanceof Raise s) {
            add(c, s.exc());
            add(c, s.cause());
        } else if (node instanceof Assert s) {
            c.add(s.test());
            add(c, s.msg());
        } else if (node instanceof Delete s) {
            c.addAll(s.targets());
        } else if (node instanceof Import s) {
            c.addAll(s.names());
        } else if (node instanceof ImportFrom s) {
            c.addAll(s.names());
        } else if (node instanceof Attribute e) {
            c.add(e.value());
        } else if (node instanceof Call e) {
            c.add(e.func());
            c.addAll(e.args());
            c.addAll(e.keywords());
        } else if (node instanceof Keyword k) {
            c.add(k.value());
        } else if (node instanceof Starred e) {
            c.add(e.value());
        } else if (node instanceof UnaryOp e) {
            c.add(e.operand());
        } else if (node instanceof BinOp e) {
            c.add(e.left());
            c.add(e.right());
        } else if (node instanceof BoolOp e) {
            c.addAll(e.values());
        } else if (node instanceof Compare e) {
            c.add(e.left());
            c.addAll(e.comparators());
        } else if (node instanceof IfExp e) {
            c.add(e.test());
            c.add(e.body());
            c.add(e.orelse());
        } else if (node instanceof ListExpr e) {
            c.addAll(e.elts());
        } else if (node instanceof TupleExpr e) {
            c.addAll(e.elts());
        } else if (node instanceof DictExpr e) {
            for (int i = 0; i < e.keys().size(); i++) {
                c.add(e.keys().get(i));
                c.add(e.values().get(i));
            }
        } else if (node instanceof Subscript e) {
            c.add(e.value());
            c.add(e.slice());
        } else if (node instanceof Slice e) {
            add(c, e.lower());
            add(c, e.upper());
            add(c, e.step());
        } else if (node instanceof ListComp e) {
            c.add(e.elt());
            c.addAll(e.generators());
        } else if (node instanceof GeneratorExp e) {
            c.add(e.elt());
            c.addAll(e.generators());
        } else if (node instanceof SetExpr e) {
            c.addAll(e.elts());
        } else if (node instanceof Comprehension e) {
            c.add(e.target());
            c.add(e.iter());
            c.addAll(e.ifs());
        } else if (node instanceof Lambda e) {
            c.add(e.args());
            c.add(e.body());
        } else if (node instanceof Await e) {
            c.add(e.value());
        } else if (node instanceof Yield e) {
            add(c, e.value());
        } else if (node instanceof YieldFrom e) {
            c.add(e.value());
        }
        return c;
    }

    private static void add(List<AstNode> c, AstNode node) {
        if (node != null)
            c.add(node);
    }
}
