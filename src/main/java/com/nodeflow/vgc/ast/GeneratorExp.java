package com.nodeflow.vgc.ast;

import java.util.List;

/** {@code (elt for ... in ...)} */
public record GeneratorExp(Expr elt, List<Comprehension> generators) implements Expr {

    public GeneratorExp {
        generators = List.copyOf(generators);
        if (generators.isEmpty())
            throw new IllegalArgumentException("comprehension needs at least one generator");
    }
}
