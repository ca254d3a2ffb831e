package com.nodeflow.vgc.ast;

import java.util.List;

/** One {@code for target in iter [if cond]*} clause of a comprehension. */
public record Comprehension(Expr target, Expr iter, List<Expr> ifs, boolean isAsync) implements AstNode {

    public Comprehension {
        ifs = List.copyOf(ifs);
    }
}
