package com.nodeflow.vgc.ast;

/** {@code value.attr} */
public record Attribute(Expr value, String attr) implements Expr {

    /** Builds {@code a.b.c} from a dotted path. */
    public static Expr dotted(String path) {
        String[] parts = path.split("\\.");
        Expr e = new Name(parts[0]);
        for (int i = 1; i < parts.length; i++)
            e = new Attribute(e, parts[i]);
        return e;
    }
}
