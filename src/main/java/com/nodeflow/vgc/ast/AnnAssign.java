package com.nodeflow.vgc.ast;

/** Annotated assignment. {@code value} may be null for a bare declaration. */
public record AnnAssign(Expr target, Expr annotation, Expr value) implements Stmt {
}
