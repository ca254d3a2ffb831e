package com.nodeflow.vgc.ast;

import java.util.List;

public record ClassDef(String name, List<Expr> bases, List<Keyword> keywords, List<Stmt> body,
        List<Expr> decorators) implements Stmt {

    public ClassDef {
        bases = List.copyOf(bases);
        keywords = List.copyOf(keywords);
        body = List.copyOf(body);
        decorators = List.copyOf(decorators);
    }

    public static ClassDef of(String name, List<Expr> bases, Stmt... body) {
        return new ClassDef(name, bases, List.of(), List.of(body), List.of());
    }

    public ClassDef withBody(List<Stmt> newBody) {
        return new ClassDef(name, bases, keywords, newBody, decorators);
    }
}
