package com.nodeflow.vgc.ast;

/** {@code value} may be null for a bare {@code yield}. */
public record Yield(Expr value) implements Expr {
}
