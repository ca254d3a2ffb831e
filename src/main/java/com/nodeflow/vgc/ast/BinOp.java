package com.nodeflow.vgc.ast;

/** Arithmetic or bitwise binary operation; {@code op} is the operator token. */
public record BinOp(Expr left, String op, Expr right) implements Expr {
}
