package com.nodeflow.vgc.ast;

/** {@code lower:upper:step} inside a subscript; each part may be null. */
public record Slice(Expr lower, Expr upper, Expr step) implements Expr {
}
