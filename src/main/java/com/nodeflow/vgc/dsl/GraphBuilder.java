package com.nodeflow.vgc.dsl;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import com.nodeflow.vgc.api.NodeKind;
import com.nodeflow.vgc.api.Port;
import com.nodeflow.vgc.api.TypeDescriptor;
import com.nodeflow.vgc.api.Types;
import com.nodeflow.vgc.api.VisualNode;
import com.nodeflow.vgc.engine.VisualGraph;

/**
 * Graph Builder -- fluent API for assembling a visual program in code.
 *
 * Usage Pattern:
 * 1. Create a builder: GraphBuilder g = GraphBuilder.create("my_graph");
 * 2. Add nodes under unique labels: g.variable("x", 10L).function("show", "print", Port.input("args", Types.OBJECT));
 * 3. Wire ports: g.connect("x", "value", "show", "args");
 * 4. Build: VisualGraph graph = g.build();
 *
 * Labels are builder-local names; they become the node's display name.
 * Unlike the editor, the builder fails fast: a duplicate label or a refused
 * connection throws {@link IllegalArgumentException}.
 */
public final class GraphBuilder {
    /** Output port every builder-made node exposes, besides variables' {@code value}. */
    public static final String RESULT_PORT = "result";
    public static final String VALUE_PORT = "value";

    private final VisualGraph graph;
    private final Map<String, UUID> idsByLabel = new HashMap<>();

    // Flag to prevent modification after building
    private boolean built;

    private GraphBuilder(String graphName) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("name", graphName);
        this.graph = new VisualGraph(metadata);
    }

    public static GraphBuilder create(String graphName) {
        return new GraphBuilder(graphName);
    }

    // ── Nodes ────────────────────────────────────────────────────

    /**
     * A variable {@code label = defaultValue}. The node has an optional
     * {@code value} input and a {@code value} output typed after the default.
     */
    public GraphBuilder variable(String label, Object defaultValue) {
        TypeDescriptor type = typeOf(defaultValue);
        return add(label, VisualNode.builder()
                .kind(NodeKind.VARIABLE)
                .parameter("variable_name", label)
                .parameter("default_value", defaultValue)
                .input(Port.optionalInput(VALUE_PORT, type, null))
                .output(Port.output(VALUE_PORT, type)));
    }

    /** A call of {@code functionName} with the given inputs and a {@code result} output. */
    public GraphBuilder function(String label, String functionName, Port... inputs) {
        return add(label, VisualNode.builder()
                .kind(NodeKind.FUNCTION)
                .parameter("function_name", functionName)
                .inputs(List.of(inputs))
                .output(Port.output(RESULT_PORT, Types.OBJECT)));
    }

    /** A control-flow statement; {@code controlType} is if, for, while, try or with. */
    public GraphBuilder control(String label, String controlType) {
        return add(label, VisualNode.builder()
                .kind(NodeKind.CONTROL_FLOW)
                .parameter("control_type", controlType)
                .input(Port.optionalInput("condition", Types.BOOL, null))
                .input(Port.optionalInput("iterable", Types.OBJECT, null)));
    }

    /** A class definition of the given {@code class_type} (basic, abstract, dataclass, singleton). */
    public GraphBuilder classNode(String label, String className, String classType) {
        return add(label, VisualNode.builder()
                .kind(NodeKind.CLASS)
                .parameter("class_name", className)
                .parameter("class_type", classType));
    }

    /** Any other node, with explicit kind and parameters and no ports. */
    public GraphBuilder node(String label, NodeKind kind, Map<String, Object> parameters) {
        return add(label, VisualNode.builder().kind(kind).parameters(parameters));
    }

    /** A node built elsewhere; its display name is replaced by {@code label}. */
    public GraphBuilder node(String label, VisualNode node) {
        checkNotBuilt();
        register(label, node.getId());
        node.setName(label);
        graph.addNode(node);
        return this;
    }

    // ── Annotations ──────────────────────────────────────────────

    public GraphBuilder comment(String label, String comment) {
        checkNotBuilt();
        nodeFor(label).addComment(comment);
        return this;
    }

    public GraphBuilder docstring(String label, String docstring) {
        checkNotBuilt();
        nodeFor(label).setDocstring(docstring);
        return this;
    }

    public GraphBuilder metadata(String key, Object value) {
        checkNotBuilt();
        graph.metadata().put(key, value);
        return this;
    }

    public GraphBuilder position(String label, double x, double y) {
        checkNotBuilt();
        graph.moveNode(id(label), x, y);
        return this;
    }

    // ── Edges ────────────────────────────────────────────────────

    /**
     * @throws IllegalArgumentException if the graph refuses the connection
     */
    public GraphBuilder connect(String from, String fromPort, String to, String toPort) {
        checkNotBuilt();
        if (graph.connect(id(from), fromPort, id(to), toPort).isEmpty())
            throw new IllegalArgumentException(
                    "Cannot connect " + from + "." + fromPort + " -> " + to + "." + toPort);
        return this;
    }

    // ── Build ────────────────────────────────────────────────────

    public VisualGraph build() {
        checkNotBuilt();
        built = true;
        return graph;
    }

    /** Id of the node registered under {@code label}. */
    public UUID id(String label) {
        UUID id = idsByLabel.get(label);
        if (id == null)
            throw new IllegalArgumentException("Unknown node label: " + label);
        return id;
    }

    private GraphBuilder add(String label, VisualNode.VisualNodeBuilder node) {
        checkNotBuilt();
        VisualNode created = node.name(label).build();
        register(label, created.getId());
        graph.addNode(created);
        return this;
    }

    private VisualNode nodeFor(String label) {
        return graph.node(id(label)).orElseThrow();
    }

    private void register(String label, UUID id) {
        if (idsByLabel.containsKey(label))
            throw new IllegalArgumentException("Duplicate node label: " + label);
        idsByLabel.put(label, id);
    }

    private void checkNotBuilt() {
        if (built)
            throw new IllegalStateException("Graph already built");
    }

    static TypeDescriptor typeOf(Object value) {
        if (value instanceof Boolean)
            return Types.BOOL;
        if (value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte)
            return Types.INT;
        if (value instanceof Float || value instanceof Double)
            return Types.FLOAT;
        if (value instanceof String)
            return Types.STR;
        if (value instanceof List)
            return Types.LIST;
        if (value instanceof Map)
            return Types.DICT;
        if (value == null)
            return Types.NONE;
        return Types.OBJECT;
    }
}
