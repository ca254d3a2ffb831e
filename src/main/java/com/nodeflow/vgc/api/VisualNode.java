package com.nodeflow.vgc.api;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.Setter;
import lombok.Singular;

/**
 * A node of the visual program.
 *
 * <p>
 * Identity is the {@link #getId() id}. Layout position is presentation state
 * owned by the canvas; it takes no part in equality or in compilation.
 */
@Getter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public final class VisualNode {

    /** Canvas coordinates. */
    public record Position(double x, double y) {
        public static final Position ORIGIN = new Position(0.0, 0.0);
    }

    @EqualsAndHashCode.Include
    private final UUID id;
    private final NodeKind kind;
    @Setter
    private String name;
    @Setter
    private Position position;
    private final Map<String, Object> parameters;
    private final List<Port> inputs;
    private final List<Port> outputs;
    private final List<String> comments;
    @Setter
    private String docstring;

    @Builder
    private VisualNode(UUID id, NodeKind kind, String name, Position position,
            @Singular Map<String, Object> parameters, @Singular List<Port> inputs, @Singular List<Port> outputs,
            @Singular List<String> comments, String docstring) {
        this.id = id != null ? id : UUID.randomUUID();
        this.kind = kind != null ? kind : NodeKind.FUNCTION;
        this.name = name != null ? name : "";
        this.position = position != null ? position : Position.ORIGIN;
        this.parameters = new LinkedHashMap<>(parameters);
        this.inputs = new ArrayList<>(inputs);
        this.outputs = new ArrayList<>(outputs);
        this.comments = new ArrayList<>(comments);
        this.docstring = docstring;
    }

    public static VisualNode of(NodeKind kind) {
        return builder().kind(kind).build();
    }

    /** Short id prefix used for synthesized identifiers. */
    public String shortId() {
        return id.toString().substring(0, 8);
    }

    public Object parameter(String key) {
        return parameters.get(key);
    }

    /** String parameter, or {@code fallback} when absent or null. */
    public String stringParameter(String key, String fallback) {
        Object v = parameters.get(key);
        return v != null ? v.toString() : fallback;
    }

    public Optional<Port> inputPort(String name) {
        for (Port p : inputs)
            if (p.name().equals(name))
                return Optional.of(p);
        return Optional.empty();
    }

    public Optional<Port> outputPort(String name) {
        for (Port p : outputs)
            if (p.name().equals(name))
                return Optional.of(p);
        return Optional.empty();
    }

    public void addComment(String comment) {
        comments.add(comment);
    }

    public Optional<String> docstringIfPresent() {
        return docstring == null || docstring.isEmpty() ? Optional.empty() : Optional.of(docstring);
    }

    /**
     * Per-node structural checks: duplicate port names and the parameters
     * required by this node's kind. Never throws.
     */
    public List<ValidationError> validate() {
        List<ValidationError> errors = new ArrayList<>();
        if (hasDuplicates(inputs))
            errors.add(ValidationError.of(ValidationError.Category.DUPLICATE_PORT,
                    "Duplicate input port names found", id));
        if (hasDuplicates(outputs))
            errors.add(ValidationError.of(ValidationError.Category.DUPLICATE_PORT,
                    "Duplicate output port names found", id));
        for (String required : kind.requiredParameters()) {
            if (!parameters.containsKey(required))
                errors.add(ValidationError.of(ValidationError.Category.MISSING_PARAMETER,
                        capitalize(kind.value()) + " nodes must have '" + required + "' parameter", id));
        }
        return errors;
    }

    private static boolean hasDuplicates(List<Port> ports) {
        Set<String> seen = new HashSet<>();
        for (Port p : ports)
            if (!seen.add(p.name()))
                return true;
        return false;
    }

    private static String capitalize(String s) {
        return s.isEmpty() ? s : Character.toUpperCase(s.charAt(0)) + s.substring(1);
    }

    @Override
    public String toString() {
        return kind.value() + "[" + shortId() + (name.isEmpty() ? "" : " " + name) + "]";
    }
}
