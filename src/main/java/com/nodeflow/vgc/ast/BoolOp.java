package com.nodeflow.vgc.ast;

import java.util.List;

/** {@code and}/{@code or} over two or more operands. */
public record BoolOp(String op, List<Expr> values) implements Expr {

    public BoolOp {
        values = List.copyOf(values);
    }
}
