package com.nodeflow.vgc.lowering;

import com.nodeflow.vgc.ast.Constant;
import com.nodeflow.vgc.ast.DictExpr;
import com.nodeflow.vgc.ast.Expr;
import com.nodeflow.vgc.ast.ListExpr;
import com.nodeflow.vgc.ast.Name;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Converts parameter values, as they arrive from code or from a JSON graph
 * definition, into literal expressions.
 */
public final class Literals {

    private Literals() {
    }

    /**
     * Strings, numbers, booleans and null become constants; collections
     * become list literals and maps dict literals. Anything else is referenced
     * by name using its {@code toString()}.
     */
    public static Expr toExpr(Object value) {
        if (value == null || value instanceof String || value instanceof Number || value instanceof Boolean)
            return Constant.of(value);
        if (value instanceof Collection<?> items) {
            List<Expr> elts = new ArrayList<>(items.size());
            for (Object o : items)
                elts.add(toExpr(o));
            return new ListExpr(elts);
        }
        if (value instanceof Map<?, ?> map) {
            List<Expr> keys = new ArrayList<>(map.size());
            List<Expr> values = new ArrayList<>(map.size());
            for (Map.Entry<?, ?> e : map.entrySet()) {
                keys.add(toExpr(e.getKey()));
                values.add(toExpr(e.getValue()));
            }
            return new DictExpr(keys, values);
        }
        return new Name(value.toString());
    }

    /** Reads a list-of-strings parameter; a single string is a one-element list. */
    public static List<String> stringList(Object value) {
        List<String> out = new ArrayList<>();
        if (value instanceof Collection<?> items) {
            for (Object o : items)
                if (o != null)
                    out.add(o.toString());
        } else if (value != null) {
            out.add(value.toString());
        }
        return out;
    }
}
