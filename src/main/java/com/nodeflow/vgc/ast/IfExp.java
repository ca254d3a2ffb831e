package com.nodeflow.vgc.ast;

/** {@code body if test else orelse} */
public record IfExp(Expr test, Expr body, Expr orelse) implements Expr {
}
