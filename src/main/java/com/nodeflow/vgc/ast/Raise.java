package com.nodeflow.vgc.ast;

/** {@code raise [exc [from cause]]}. Both parts may be null. */
public record Raise(Expr exc, Expr cause) implements Stmt {
}
