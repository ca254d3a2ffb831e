package com.nodeflow.vgc.ast;

import java.util.List;

public record TupleExpr(List<Expr> elts) implements Expr {

    public TupleExpr {
        elts = List.copyOf(elts);
    }

    @Override
    public String kind() {
        return "Tuple";
    }
}
