package com.nodeflow.vgc.api;

/**
 * Observer of structural changes to a graph.
 *
 * <p>
 * Callbacks run synchronously on the mutating thread, after the change has
 * been applied. The audit ledger and the canvas subscribe here; the compiler
 * itself never does. Every callback defaults to a no-op.
 */
public interface GraphMutationListener {

    default void onNodeAdded(VisualNode node) {
    }

    default void onNodeRemoved(VisualNode node) {
    }

    /**
     * @param node     The node after the move.
     * @param previous Position before the move.
     */
    default void onNodeMoved(VisualNode node, VisualNode.Position previous) {
    }

    default void onConnectionAdded(Connection connection) {
    }

    default void onConnectionRemoved(Connection connection) {
    }
}
