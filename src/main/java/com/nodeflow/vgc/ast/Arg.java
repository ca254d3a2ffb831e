package com.nodeflow.vgc.ast;

/**
 * A formal parameter.
 *
 * @param annotation   May be null.
 * @param defaultValue May be null.
 */
public record Arg(String name, Expr annotation, Expr defaultValue) implements AstNode {

    public static Arg of(String name) {
        return new Arg(name, null, null);
    }

    public Arg withAnnotation(Expr newAnnotation) {
        return new Arg(name, newAnnotation, defaultValue);
    }
}
