package com.nodeflow.vgc.api;

import java.util.Objects;

/**
 * A typed input or output socket on a {@link VisualNode}.
 *
 * @param name         Unique within the owning node's inputs (or outputs).
 * @param semanticType Type tag used for connection compatibility.
 * @param required     Inputs only; outputs are never required.
 * @param defaultValue Literal used by lowering when the input is unbound, may
 *                     be null.
 * @param description  Free text shown in the editor.
 */
public record Port(String name, TypeDescriptor semanticType, boolean required, Object defaultValue,
        String description) {

    public Port {
        Objects.requireNonNull(name, "name");
        semanticType = semanticType != null ? semanticType : Types.OBJECT;
        description = description != null ? description : "";
    }

    public static Port input(String name, TypeDescriptor type) {
        return new Port(name, type, true, null, "");
    }

    public static Port optionalInput(String name, TypeDescriptor type, Object defaultValue) {
        return new Port(name, type, false, defaultValue, "");
    }

    public static Port output(String name, TypeDescriptor type) {
        return new Port(name, type, false, null, "");
    }

    public boolean isCompatibleWith(Port other) {
        return other != null && semanticType.isCompatibleWith(other.semanticType);
    }
}
