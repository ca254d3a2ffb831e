package com.nodeflow.vgc.ast;

/**
 * A literal. {@code value} is a {@link String}, {@link Boolean}, {@link Long},
 * {@link Double} or null ({@code None}). Other {@link Number}s are widened.
 */
public record Constant(Object value) implements Expr {
    public static final Constant NONE = new Constant(null);
    public static final Constant TRUE = new Constant(Boolean.TRUE);
    public static final Constant FALSE = new Constant(Boolean.FALSE);

    public Constant {
        if (value instanceof Integer || value instanceof Short || value instanceof Byte)
            value = ((Number) value).longValue();
        else if (value instanceof Float)
            value = ((Float) value).doubleValue();
    }

    public static Constant of(Object value) {
        return new Constant(value);
    }
}
