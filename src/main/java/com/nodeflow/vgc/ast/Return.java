package com.nodeflow.vgc.ast;

/** {@code value} may be null for a bare {@code return}. */
public record Return(Expr value) implements Stmt {
}
