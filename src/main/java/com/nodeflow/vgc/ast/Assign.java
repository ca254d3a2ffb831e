package com.nodeflow.vgc.ast;

import java.util.List;

public record Assign(List<Expr> targets, Expr value) implements Stmt {

    public Assign {
        targets = List.copyOf(targets);
    }

    public static Assign of(String name, Expr value) {
        return new Assign(List.of(new Name(name)), value);
    }

    /** The target name when this is a single plain-name assignment, otherwise null. */
    public String singleName() {
        return targets.size() == 1 && targets.get(0) instanceof Name n ? n.id() : null;
    }
}
