package com.nodeflow.vgc.ast;

/**
 * A source comment standing in for a statement. Rendered as one
 * {@code # } line per line of text.
 */
public record Comment(String text) implements Stmt {
}
