package com.nodeflow.vgc.api;

import java.util.Objects;
import java.util.UUID;

/**
 * A directed edge from one node's output port to another node's input port.
 *
 * @param carriedType Copied from the source output port when created through
 *                    {@code VisualGraph.connect}.
 */
public record Connection(UUID id, UUID sourceNodeId, String sourcePort, UUID targetNodeId, String targetPort,
        TypeDescriptor carriedType) {

    public Connection {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(sourceNodeId, "sourceNodeId");
        Objects.requireNonNull(targetNodeId, "targetNodeId");
        carriedType = carriedType != null ? carriedType : Types.NONE;
    }

    public static Connection between(UUID sourceNodeId, String sourcePort, UUID targetNodeId, String targetPort) {
        return new Connection(UUID.randomUUID(), sourceNodeId, sourcePort, targetNodeId, targetPort, null);
    }

    /** Key identifying the bound input, {@code "<targetId>.<targetPort>"}. */
    public String targetKey() {
        return targetNodeId + "." + targetPort;
    }

    public boolean touches(UUID nodeId) {
        return sourceNodeId.equals(nodeId) || targetNodeId.equals(nodeId);
    }
}
