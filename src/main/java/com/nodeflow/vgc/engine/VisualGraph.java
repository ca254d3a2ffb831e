package com.nodeflow.vgc.engine;

import com.nodeflow.vgc.api.Connection;
import com.nodeflow.vgc.api.GraphMutationListener;
import com.nodeflow.vgc.api.Port;
import com.nodeflow.vgc.api.ValidationError;
import com.nodeflow.vgc.api.VisualNode;
import com.nodeflow.vgc.util.CompositeGraphMutationListener;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * The visual model: nodes, the connections between their ports, and free-form
 * graph metadata.
 *
 * <p>
 * Nodes keep insertion order, which is also the tie-break order of
 * {@link #executionOrder()}. All structural changes go through this class so
 * the invariants are re-checked and listeners are notified:
 * <ul>
 * <li>{@link #connect} refuses missing nodes or ports, incompatible port types,
 * a second connection into an already bound input, and any edge that would
 * close a cycle.</li>
 * <li>{@link #removeNode} removes every connection touching the node.</li>
 * </ul>
 *
 * <p>
 * Not thread-safe. A graph must not be mutated while {@link #validate()},
 * {@link #executionOrder()} or lowering are running on it.
 */
public final class VisualGraph {
    private static final Logger log = LogManager.getLogger(VisualGraph.class);

    private final Map<UUID, VisualNode> nodes = new LinkedHashMap<>();
    private final List<Connection> connections = new ArrayList<>();
    private final Map<String, Object> metadata = new LinkedHashMap<>();
    private final CompositeGraphMutationListener listeners = new CompositeGraphMutationListener();

    public VisualGraph() {
    }

    public VisualGraph(Map<String, Object> metadata) {
        if (metadata != null)
            this.metadata.putAll(metadata);
    }

    public void addListener(GraphMutationListener listener) {
        listeners.addForComposite(listener);
    }

    public void removeListener(GraphMutationListener listener) {
        listeners.removeFromComposite(listener);
    }

    // ── Nodes ──────────────────────────────────────────────────────

    public UUID addNode(VisualNode node) {
        Objects.requireNonNull(node, "node");
        nodes.put(node.getId(), node);
        listeners.onNodeAdded(node);
        return node.getId();
    }

    /** Removes the node and all connections touching it. */
    public boolean removeNode(UUID nodeId) {
        VisualNode node = nodes.get(nodeId);
        if (node == null)
            return false;

        List<Connection> touching = new ArrayList<>();
        connections.removeIf(c -> {
            if (c.touches(nodeId)) {
                touching.add(c);
                return true;
            }
            return false;
        });
        nodes.remove(nodeId);

        for (Connection c : touching)
            listeners.onConnectionRemoved(c);
        listeners.onNodeRemoved(node);
        return true;
    }

    /** Updates presentation state only. */
    public boolean moveNode(UUID nodeId, double x, double y) {
        VisualNode node = nodes.get(nodeId);
        if (node == null)
            return false;
        VisualNode.Position previous = node.getPosition();
        node.setPosition(new VisualNode.Position(x, y));
        listeners.onNodeMoved(node, previous);
        return true;
    }

    public Optional<VisualNode> node(UUID nodeId) {
        return Optional.ofNullable(nodes.get(nodeId));
    }

    public boolean containsNode(UUID nodeId) {
        return nodes.containsKey(nodeId);
    }

    /** Read-only view in insertion order. */
    public Collection<VisualNode> nodes() {
        return Collections.unmodifiableCollection(nodes.values());
    }

    public int nodeCount() {
        return nodes.size();
    }

    // ── Connections ────────────────────────────────────────────────

    /**
     * Creates a connection from an output port to an input port.
     *
     * @return the new connection, or empty if the edge is not allowed.
     */
    public Optional<Connection> connect(UUID sourceId, String sourcePort, UUID targetId, String targetPort) {
        VisualNode source = nodes.get(sourceId);
        VisualNode target = nodes.get(targetId);
        if (source == null || target == null) {
            log.debug("connect rejected: unknown node {} or {}", sourceId, targetId);
            return Optional.empty();
        }

        Optional<Port> out = source.outputPort(sourcePort);
        Optional<Port> in = target.inputPort(targetPort);
        if (out.isEmpty() || in.isEmpty()) {
            log.debug("connect rejected: missing port {}.{} or {}.{}", source, sourcePort, target, targetPort);
            return Optional.empty();
        }
        if (!out.get().isCompatibleWith(in.get())) {
            log.debug("connect rejected: {} ({}) is not compatible with {} ({})", sourcePort,
                    out.get().semanticType(), targetPort, in.get().semanticType());
            return Optional.empty();
        }
        if (isInputBound(targetId, targetPort)) {
            log.debug("connect rejected: input {}.{} already bound", target, targetPort);
            return Optional.empty();
        }

        DependencyView view = dependencyView();
        if (view.reaches(view.index(targetId), view.index(sourceId))) {
            log.debug("connect rejected: {} -> {} would create a cycle", source, target);
            return Optional.empty();
        }

        Connection connection = new Connection(UUID.randomUUID(), sourceId, sourcePort, targetId, targetPort,
                out.get().semanticType());
        connections.add(connection);
        listeners.onConnectionAdded(connection);
        return Optional.of(connection);
    }

    /**
     * Appends a pre-built connection after checking only that both endpoint
     * nodes exist. Port existence, type compatibility and acyclicity are left
     * to {@link #validate()}.
     */
    public boolean addConnection(Connection connection) {
        Objects.requireNonNull(connection, "connection");
        if (!nodes.containsKey(connection.sourceNodeId()) || !nodes.containsKey(connection.targetNodeId()))
            return false;
        connections.add(connection);
        listeners.onConnectionAdded(connection);
        return true;
    }

    public boolean removeConnection(UUID connectionId) {
        for (int i = 0; i < connections.size(); i++) {
            Connection c = connections.get(i);
            if (c.id().equals(connectionId)) {
                connections.remove(i);
                listeners.onConnectionRemoved(c);
                return true;
            }
        }
        return false;
    }

    /** Read-only view in creation order. */
    public List<Connection> connections() {
        return Collections.unmodifiableList(connections);
    }

    public List<Connection> incoming(UUID nodeId) {
        return connections.stream().filter(c -> c.targetNodeId().equals(nodeId)).collect(Collectors.toList());
    }

    public List<Connection> outgoing(UUID nodeId) {
        return connections.stream().filter(c -> c.sourceNodeId().equals(nodeId)).collect(Collectors.toList());
    }

    public boolean isInputBound(UUID nodeId, String inputPort) {
        for (Connection c : connections)
            if (c.targetNodeId().equals(nodeId) && c.targetPort().equals(inputPort))
                return true;
        return false;
    }

    // ── Metadata ───────────────────────────────────────────────────

    /** Mutable graph metadata (description, author, version, ...). */
    public Map<String, Object> metadata() {
        return metadata;
    }

    // ── Analysis ───────────────────────────────────────────────────

    /**
     * Collects every structural problem of the graph. Never throws.
     * <p>
     * Per-node problems come first in insertion order, then dangling
     * connection endpoints, then at most one circular-dependency error.
     */
    public List<ValidationError> validate() {
        List<ValidationError> errors = new ArrayList<>();
        for (VisualNode node : nodes.values())
            errors.addAll(node.validate());

        for (Connection c : connections) {
            VisualNode source = nodes.get(c.sourceNodeId());
            VisualNode target = nodes.get(c.targetNodeId());
            if (source == null)
                errors.add(ValidationError.of(ValidationError.Category.DANGLING_CONNECTION,
                        "Connection references missing source node: " + c.sourceNodeId()));
            else if (source.outputPort(c.sourcePort()).isEmpty())
                errors.add(ValidationError.of(ValidationError.Category.DANGLING_CONNECTION,
                        "Connection references missing output port: " + c.sourceNodeId() + "." + c.sourcePort(),
                        c.sourceNodeId()));
            if (target == null)
                errors.add(ValidationError.of(ValidationError.Category.DANGLING_CONNECTION,
                        "Connection references missing target node: " + c.targetNodeId()));
            else if (target.inputPort(c.targetPort()).isEmpty())
                errors.add(ValidationError.of(ValidationError.Category.DANGLING_CONNECTION,
                        "Connection references missing input port: " + c.targetKey(), c.targetNodeId()));
        }

        CycleDetector.findCycle(dependencyView()).ifPresent(cycle -> errors.add(ValidationError.of(
                ValidationError.Category.CIRCULAR_DEPENDENCY,
                "Model contains circular dependencies: "
                        + cycle.stream().map(this::label).collect(Collectors.joining(" -> ")),
                cycle.get(0))));
        return errors;
    }

    /**
     * Node ids in execution order.
     *
     * @return every node id, or an empty list if a cycle prevents ordering.
     *         Callers must treat empty-with-nodes as "unorderable".
     */
    public List<UUID> executionOrder() {
        return topologicalOrder().toList();
    }

    /** Full Kahn result, including how far ordering got on a cyclic graph. */
    public TopologicalOrder topologicalOrder() {
        return TopologicalOrder.compute(dependencyView());
    }

    private DependencyView dependencyView() {
        return DependencyView.of(nodes.keySet(), connections);
    }

    private String label(UUID id) {
        VisualNode node = nodes.get(id);
        return node != null ? node.toString() : id.toString();
    }
}
