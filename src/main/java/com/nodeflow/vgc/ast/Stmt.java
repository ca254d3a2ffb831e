package com.nodeflow.vgc.ast;

/** Marker for statement nodes. */
public interface Stmt extends AstNode {
}
