package com.nodeflow.vgc.ast;

/** {@code op} is one of {@code not - + ~}. */
public record UnaryOp(String op, Expr operand) implements Expr {

    public static UnaryOp not(Expr operand) {
        return new UnaryOp("not", operand);
    }
}
