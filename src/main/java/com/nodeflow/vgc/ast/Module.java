package com.nodeflow.vgc.ast;

import java.util.List;

/** A whole compilation unit. */
public record Module(List<Stmt> body) implements AstNode {

    public Module {
        body = List.copyOf(body);
    }

    public static Module of(Stmt... body) {
        return new Module(List.of(body));
    }

    public boolean isEmpty() {
        return body.isEmpty();
    }
}
