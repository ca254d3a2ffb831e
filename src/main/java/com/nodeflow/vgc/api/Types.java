package com.nodeflow.vgc.api;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Built-in {@link TypeDescriptor}s and a by-name lookup.
 */
public final class Types {
    public static final TypeDescriptor OBJECT = new TypeDescriptor("object", null);
    public static final TypeDescriptor INT = new TypeDescriptor("int", OBJECT);
    public static final TypeDescriptor BOOL = new TypeDescriptor("bool", INT);
    public static final TypeDescriptor FLOAT = new TypeDescriptor("float", OBJECT);
    public static final TypeDescriptor COMPLEX = new TypeDescriptor("complex", OBJECT);
    public static final TypeDescriptor STR = new TypeDescriptor("str", OBJECT);
    public static final TypeDescriptor BYTES = new TypeDescriptor("bytes", OBJECT);
    public static final TypeDescriptor LIST = new TypeDescriptor("list", OBJECT);
    public static final TypeDescriptor TUPLE = new TypeDescriptor("tuple", OBJECT);
    public static final TypeDescriptor DICT = new TypeDescriptor("dict", OBJECT);
    public static final TypeDescriptor SET = new TypeDescriptor("set", OBJECT);
    public static final TypeDescriptor NONE = new TypeDescriptor("NoneType", OBJECT);

    private static final Map<String, TypeDescriptor> BY_NAME = new ConcurrentHashMap<>();

    static {
        for (TypeDescriptor t : new TypeDescriptor[] { OBJECT, INT, BOOL, FLOAT, COMPLEX, STR, BYTES, LIST, TUPLE,
                DICT, SET, NONE })
            BY_NAME.put(t.name(), t);
        BY_NAME.put("Any", OBJECT);
    }

    private Types() {
        // Constants holder
    }

    /**
     * Resolves a type by name. Unknown names are registered as direct
     * subtypes of {@link #OBJECT} so repeated lookups return the same tag.
     */
    public static TypeDescriptor byName(String name) {
        if (name == null || name.isBlank())
            return OBJECT;
        return BY_NAME.computeIfAbsent(name.trim(), n -> new TypeDescriptor(n, OBJECT));
    }

    /**
     * Declares a custom type under the given supertype. Re-declaring an
     * existing name returns the existing descriptor.
     */
    public static TypeDescriptor declare(String name, TypeDescriptor supertype) {
        return BY_NAME.computeIfAbsent(name, n -> new TypeDescriptor(n, supertype != null ? supertype : OBJECT));
    }
}
