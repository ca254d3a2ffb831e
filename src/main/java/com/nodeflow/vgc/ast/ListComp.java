package com.nodeflow.vgc.ast;

import java.util.List;

/** {@code [elt for ... in ... if ...]} */
public record ListComp(Expr elt, List<Comprehension> generators) implements Expr {

    public ListComp {
        generators = List.copyOf(generators);
        if (generators.isEmpty())
            throw new IllegalArgumentException("comprehension needs at least one generator");
    }
}
