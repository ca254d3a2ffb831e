package com.nodeflow.vgc.ast;

import java.util.List;

public record Call(Expr func, List<Expr> args, List<Keyword> keywords) implements Expr {

    public Call {
        args = List.copyOf(args);
        keywords = List.copyOf(keywords);
    }

    public static Call of(String function, Expr... args) {
        return new Call(new Name(function), List.of(args), List.of());
    }

    public static Call of(Expr function, Expr... args) {
        return new Call(function, List.of(args), List.of());
    }
}
