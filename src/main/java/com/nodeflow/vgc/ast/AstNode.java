package com.nodeflow.vgc.ast;

/**
 * Common supertype of every syntax tree node.
 *
 * <p>
 * Nodes are immutable records. Passes that change a tree build a new one,
 * usually through {@link AstTransformer}.
 */
public interface AstNode {

    /** Kind tag, e.g. {@code "Assign"} or {@code "AsyncFunctionDef"}. */
    default String kind() {
        return getClass().getSimpleName();
    }
}
