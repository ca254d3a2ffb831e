package com.nodeflow.vgc.ast;

/** {@code target op= value}; {@code op} is the bare operator, e.g. {@code "+"}. */
public record AugAssign(Expr target, String op, Expr value) implements Stmt {
}
