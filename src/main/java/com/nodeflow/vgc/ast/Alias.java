package com.nodeflow.vgc.ast;

/** An imported name; {@code asName} may be null. */
public record Alias(String name, String asName) implements AstNode {
}
