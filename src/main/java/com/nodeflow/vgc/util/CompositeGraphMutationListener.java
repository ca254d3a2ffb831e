package com.nodeflow.vgc.util;

import com.nodeflow.vgc.api.Connection;
import com.nodeflow.vgc.api.GraphMutationListener;
import com.nodeflow.vgc.api.VisualNode;

import java.util.Arrays;

/**
 * Fans out graph mutation callbacks to several {@link GraphMutationListener}s,
 * in registration order.
 */
public class CompositeGraphMutationListener implements GraphMutationListener {
    private GraphMutationListener[] listeners = new GraphMutationListener[0];

    public void addForComposite(GraphMutationListener listener) {
        GraphMutationListener[] old = listeners;
        GraphMutationListener[] next = Arrays.copyOf(old, old.length + 1);
        next[old.length] = listener;
        listeners = next;
    }

    public boolean removeFromComposite(GraphMutationListener listener) {
        GraphMutationListener[] old = listeners;
        for (int i = 0; i < old.length; i++) {
            if (old[i] == listener) {
                GraphMutationListener[] next = new GraphMutationListener[old.length - 1];
                System.arraycopy(old, 0, next, 0, i);
                System.arraycopy(old, i + 1, next, i, old.length - i - 1);
                listeners = next;
                return true;
            }
        }
        return false;
    }

    public int size() {
        return listeners.length;
    }

    @Override
    public void onNodeAdded(VisualNode node) {
        for (GraphMutationListener l : listeners)
            l.onNodeAdded(node);
    }

    @Override
    public void onNodeRemoved(VisualNode node) {
        for (GraphMutationListener l : listeners)
            l.onNodeRemoved(node);
    }

    @Override
    public void onNodeMoved(VisualNode node, VisualNode.Position previous) {
        for (GraphMutationListener l : listeners)
            l.onNodeMoved(node, previous);
    }

    @Override
    public void onConnectionAdded(Connection connection) {
        for (GraphMutationListener l : listeners)
            l.onConnectionAdded(connection);
    }

    @Override
    public void onConnectionRemoved(Connection connection) {
        for (GraphMutationListener l : listeners)
            l.onConnectionRemoved(connection);
    }
}
