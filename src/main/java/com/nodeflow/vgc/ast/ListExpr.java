package com.nodeflow.vgc.ast;

import java.util.List;

public record ListExpr(List<Expr> elts) implements Expr {

    public ListExpr {
        elts = List.copyOf(elts);
    }

    @Override
    public String kind() {
        return "List";
    }
}
