package com.nodeflow.vgc.ast;

/** An expression evaluated for its side effects. */
public record ExprStmt(Expr value) implements Stmt {

    /** True if this statement is a bare string literal, i.e. a docstring candidate. */
    public boolean isStringLiteral() {
        return value instanceof Constant c && c.value() instanceof String;
    }
}
