package com.nodeflow.vgc.ast;

import java.util.List;

public record While(Expr test, List<Stmt> body, List<Stmt> orelse) implements Stmt {

    public While {
        body = List.copyOf(body);
        orelse = List.copyOf(orelse);
    }
}
