package com.nodeflow.vgc.ast;

/** {@code *value} in a call or target list. */
public record Starred(Expr value) implements Expr {
}
