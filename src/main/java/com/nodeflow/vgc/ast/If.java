package com.nodeflow.vgc.ast;

import java.util.List;

/** {@code if}; an {@code elif} chain is a single nested {@code If} in {@code orelse}. */
public record If(Expr test, List<Stmt> body, List<Stmt> orelse) implements Stmt {

    public If {
        body = List.copyOf(body);
        orelse = List.copyOf(orelse);
    }
}
