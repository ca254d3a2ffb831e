package com.nodeflow.vgc.wiring;

import java.util.UUID;

import com.nodeflow.vgc.api.Connection;
import com.nodeflow.vgc.api.NodeKind;
import com.nodeflow.vgc.api.VisualNode;

/**
 * A mutable data holder for graph mutations, used within the LMAX Disruptor
 * RingBuffer.
 *
 * <p>
 * Instances are pre-allocated when the ring buffer is built and reused for
 * every mutation. Handlers must copy what they need before returning; the
 * slot is overwritten once the sequence wraps.
 *
 * <p>
 * Only ids and plain values are carried, never the live node, so the
 * consumer thread cannot reach into the graph.
 */
public final class MutationEvent {

    public enum Type {
        NODE_ADDED, NODE_REMOVED, NODE_MOVED, CONNECTION_ADDED, CONNECTION_REMOVED
    }

    private Type type;
    private UUID entityId;
    private NodeKind nodeKind;
    private double x, y;
    private UUID sourceNodeId, targetNodeId;
    private String sourcePort, targetPort;
    private long sequenceId;

    void setNodeEvent(Type type, VisualNode node, long seqId) {
        clear();
        this.type = type;
        this.entityId = node.getId();
        this.nodeKind = node.getKind();
        this.x = node.getPosition().x();
        this.y = node.getPosition().y();
        this.sequenceId = seqId;
    }

    void setConnectionEvent(Type type, Connection connection, long seqId) {
        clear();
        this.type = type;
        this.entityId = connection.id();
        this.sourceNodeId = connection.sourceNodeId();
        this.sourcePort = connection.sourcePort();
        this.targetNodeId = connection.targetNodeId();
        this.targetPort = connection.targetPort();
        this.sequenceId = seqId;
    }

    public Type type() {
        return type;
    }

    /** Node id for node events, connection id for connection events. */
    public UUID entityId() {
        return entityId;
    }

    /** Null for connection events. */
    public NodeKind nodeKind() {
        return nodeKind;
    }

    /** Position after the mutation; zero for connection events. */
    public double x() {
        return x;
    }

    public double y() {
        return y;
    }

    public UUID sourceNodeId() {
        return sourceNodeId;
    }

    public String sourcePort() {
        return sourcePort;
    }

    public UUID targetNodeId() {
        return targetNodeId;
    }

    public String targetPort() {
        return targetPort;
    }

    public boolean isConnectionEvent() {
        return type == Type.CONNECTION_ADDED || type == Type.CONNECTION_REMOVED;
    }

    /** Publisher-side counter, starting at 1; independent of the ring sequence. */
    public long sequenceId() {
        return sequenceId;
    }

    public void clear() {
        type = null;
        entityId = null;
        nodeKind = null;
        x = 0;
        y = 0;
        sourceNodeId = null;
        targetNodeId = null;
        sourcePort = null;
        targetPort = null;
        sequenceId = 0;
    }

    @Override
    public String toString() {
        if (isConnectionEvent())
            return type + "#" + sequenceId + "[" + sourceNodeId + "." + sourcePort + " -> " + targetNodeId + "."
                    + targetPort + "]";
        return type + "#" + sequenceId + "[" + nodeKind + " " + entityId + "]";
    }
}
