package com.nodeflow.vgc.ast;

import java.util.List;

public record For(Expr target, Expr iter, List<Stmt> body, List<Stmt> orelse, boolean isAsync) implements Stmt {

    public For {
        body = List.copyOf(body);
        orelse = List.copyOf(orelse);
    }

    @Override
    public String kind() {
        return isAsync ? "AsyncFor" : "For";
    }
}
