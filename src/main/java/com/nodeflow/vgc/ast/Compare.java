package com.nodeflow.vgc.ast;

import java.util.List;

/**
 * Chained comparison {@code left op0 c0 op1 c1 ...}. Operators are tokens such
 * as {@code "<"}, {@code "not in"} or {@code "is not"}.
 */
public record Compare(Expr left, List<String> ops, List<Expr> comparators) implements Expr {

    public Compare {
        ops = List.copyOf(ops);
        comparators = List.copyOf(comparators);
        if (ops.size() != comparators.size())
            throw new IllegalArgumentException("ops and comparators differ in size");
    }
}
