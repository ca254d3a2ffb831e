package com.nodeflow.vgc.ast;

import java.util.List;

public record DictExpr(List<Expr> keys, List<Expr> values) implements Expr {

    public DictExpr {
        keys = List.copyOf(keys);
        values = List.copyOf(values);
        if (keys.size() != values.size())
            throw new IllegalArgumentException("keys and values differ in size");
    }

    @Override
    public String kind() {
        return "Dict";
    }
}
