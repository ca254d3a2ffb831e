package com.nodeflow.vgc.ast;

/** {@code value[slice]} */
public record Subscript(Expr value, Expr slice) implements Expr {
}
