package com.nodeflow.vgc.ast;

/** Keyword argument; a null {@code arg} is a {@code **value} spread. */
public record Keyword(String arg, Expr value) implements AstNode {
}
