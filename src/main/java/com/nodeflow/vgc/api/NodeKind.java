package com.nodeflow.vgc.api;

import java.util.List;

/**
 * Tag selecting the lowering strategy for a {@link VisualNode}.
 */
public enum NodeKind {
    FUNCTION("function", List.of("function_name")),
    VARIABLE("variable", List.of()),
    CONTROL_FLOW("control_flow", List.of()),
    CLASS("class", List.of()),
    DECORATOR("decorator", List.of()),
    ASYNC("async", List.of()),
    GENERATOR("generator", List.of()),
    METACLASS("metaclass", List.of()),
    CONTEXT_MANAGER("context_manager", List.of()),
    CUSTOM("custom", List.of()),
    IMPORT("import", List.of()),
    COMMENT("comment", List.of()),
    EXPRESSION("expression", List.of()),
    STATEMENT("statement", List.of()),
    MODULE("module", List.of());

    private final String value;
    private final List<String> requiredParameters;

    NodeKind(String value, List<String> requiredParameters) {
        this.value = value;
        this.requiredParameters = requiredParameters;
    }

    /** Lower-case tag used in graph definitions and placeholder comments. */
    public String value() {
        return value;
    }

    /** Parameters a node of this kind must carry to pass validation. */
    public List<String> requiredParameters() {
        return requiredParameters;
    }

    public static NodeKind fromString(String text) {
        for (NodeKind k : values()) {
            if (k.value.equalsIgnoreCase(text) || k.name().equalsIgnoreCase(text))
                return k;
        }
        throw new IllegalArgumentException("Unknown NodeKind: " + text);
    }
}
