package com.nodeflow.vgc.api;

import java.util.Objects;

/**
 * Nominal type tag carried by a {@link Port}.
 *
 * <p>
 * A descriptor optionally names a single supertype; {@link #isSubtypeOf}
 * walks that chain. The root of every chain is {@link Types#OBJECT}.
 *
 * @param name      Type name as written in generated annotations (e.g. "int").
 * @param supertype Declared supertype, or null for the root.
 */
public record TypeDescriptor(String name, TypeDescriptor supertype) {

    public TypeDescriptor {
        Objects.requireNonNull(name, "name");
    }

    /** Returns true if this type is {@code other} or one of its descendants. */
    public boolean isSubtypeOf(TypeDescriptor other) {
        if (other == null)
            return false;
        for (TypeDescriptor t = this; t != null; t = t.supertype) {
            if (t.name.equals(other.name))
                return true;
        }
        // Every chain is rooted at object even if declared without it.
        return other.name.equals(Types.OBJECT.name);
    }

    /**
     * Port compatibility check.
     * <p>
     * Symmetric: either side may be the subtype. An {@code int} output may feed an {@code object} input and an
     * {@code object} output may feed an {@code int} input.
     */
    public boolean isCompatibleWith(TypeDescriptor other) {
        return isSubtypeOf(other) || (other != null && other.isSubtypeOf(this));
    }

    @Override
    public String toString() {
        return name;
    }
}
