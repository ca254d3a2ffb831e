package com.nodeflow.vgc.ast;

/** Marker for expression nodes. */
public interface Expr extends AstNode {
}
