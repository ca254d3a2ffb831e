package com.nodeflow.vgc.api;

import java.util.UUID;

/**
 * Observability hook for the lowering pass.
 *
 * Keep implementations cheap; they run inline with lowering.
 */
public interface LoweringListener {

    /**
     * Called after a node produced its statement.
     *
     * @param index    Position of the node in the lowering order.
     * @param nodeId   The lowered node.
     * @param kind     Kind tag of the produced statement.
     */
    void onNodeLowered(int index, UUID nodeId, String kind);

    /**
     * Called when a node's mapper threw. The node is replaced by a comment.
     */
    void onNodeError(int index, UUID nodeId, Throwable error);

    /** Called for a node whose kind has no registered mapper. */
    default void onUnsupportedNode(int index, UUID nodeId, NodeKind kind) {
    }
}
