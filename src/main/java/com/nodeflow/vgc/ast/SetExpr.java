package com.nodeflow.vgc.ast;

import java.util.List;

public record SetExpr(List<Expr> elts) implements Expr {

    public SetExpr {
        elts = List.copyOf(elts);
        if (elts.isEmpty())
            throw new IllegalArgumentException("empty set display");
    }

    @Override
    public String kind() {
        return "Set";
    }
}
