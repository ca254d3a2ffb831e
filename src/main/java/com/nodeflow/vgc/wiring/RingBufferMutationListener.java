package com.nodeflow.vgc.wiring;

import com.lmax.disruptor.RingBuffer;
import com.nodeflow.vgc.api.Connection;
import com.nodeflow.vgc.api.GraphMutationListener;
import com.nodeflow.vgc.api.VisualNode;

/**
 * Publishes every graph mutation into a {@link RingBuffer}.
 *
 * <p>
 * Runs on the mutating thread. Claims the next slot, fills the pre-allocated
 * {@link MutationEvent} and publishes it; blocks only when the ring is full.
 * Meant for a single producer: the graph itself is single-threaded.
 */
public final class RingBufferMutationListener implements GraphMutationListener {
    private final RingBuffer<MutationEvent> ringBuffer;
    private long published;

    public RingBufferMutationListener(RingBuffer<MutationEvent> ringBuffer) {
        this.ringBuffer = ringBuffer;
    }

    @Override
    public void onNodeAdded(VisualNode node) {
        publishNode(MutationEvent.Type.NODE_ADDED, node);
    }

    @Override
    public void onNodeRemoved(VisualNode node) {
        publishNode(MutationEvent.Type.NODE_REMOVED, node);
    }

    @Override
    public void onNodeMoved(VisualNode node, VisualNode.Position previous) {
        publishNode(MutationEvent.Type.NODE_MOVED, node);
    }

    @Override
    public void onConnectionAdded(Connection connection) {
        publishConnection(MutationEvent.Type.CONNECTION_ADDED, connection);
    }

    @Override
    public void onConnectionRemoved(Connection connection) {
        publishConnection(MutationEvent.Type.CONNECTION_REMOVED, connection);
    }

    /** Number of events published so far. */
    public long publishedCount() {
        return published;
    }

    private void publishNode(MutationEvent.Type type, VisualNode node) {
        long sequence = ringBuffer.next();
        try {
            ringBuffer.get(sequence).setNodeEvent(type, node, ++published);
        } finally {
            ringBuffer.publish(sequence);
        }
    }

    private void publishConnection(MutationEvent.Type type, Connection connection) {
        long sequence = ringBuffer.next();
        try {
            ringBuffer.get(sequence).setConnectionEvent(type, connection, ++published);
        } finally {
            ringBuffer.publish(sequence);
        }
    }
}
