package com.nodeflow.vgc.ast;

import java.util.List;

/**
 * One {@code except} clause.
 *
 * @param type Exception expression, or null for a bare {@code except:}.
 * @param name Bound name, or null.
 */
public record ExceptHandler(Expr type, String name, List<Stmt> body) implements AstNode {

    public ExceptHandler {
        body = List.copyOf(body);
    }
}
