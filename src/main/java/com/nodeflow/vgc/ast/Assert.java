package com.nodeflow.vgc.ast;

/** {@code msg} may be null. */
public record Assert(Expr test, Expr msg) implements Stmt {
}
