package com.nodeflow.vgc.codegen;

/**
 * Python source spelling of literal values.
 */
public final class PythonLiterals {

    private PythonLiterals() {
    }

    /**
     * Spelling of a constant the way Python's {@code repr} writes it:
     * {@code None}, {@code True}/{@code False}, integers, floats with a
     * fractional part or exponent, and quoted strings.
     */
    public static String repr(Object value) {
        if (value == null)
            return "None";
        if (value instanceof Boolean b)
            return b ? "True" : "False";
        if (value instanceof Double || value instanceof Float)
            return floatRepr(((Number) value).doubleValue());
        if (value instanceof Number n)
            return n.toString();
        if (value instanceof String s)
            return stringRepr(s);
        return stringRepr(value.toString());
    }

    static String floatRepr(double d) {
        if (Double.isNaN(d))
            return "float('nan')";
        if (Double.isInfinite(d))
            return d > 0 ? "float('inf')" : "-float('inf')";
        if (d == Math.rint(d) && Math.abs(d) < 1e16)
            return Long.toString((long) d) + ".0";
        String s = Double.toString(d);
        int e = s.indexOf('E');
        if (e < 0)
            return s;
        String mantissa = s.substring(0, e);
        if (mantissa.endsWith(".0"))
            mantissa = mantissa.substring(0, mantissa.length() - 2);
        int exp = Integer.parseInt(s.substring(e + 1));
        return mantissa + "e" + (exp < 0 ? "-" : "+") + (Math.abs(exp) < 10 ? "0" : "") + Math.abs(exp);
    }

    /** Single quotes unless the text contains a single quote and no double quote. */
    public static String stringRepr(String s) {
        char quote = s.indexOf('\'') >= 0 && s.indexOf('"') < 0 ? '"' : '\'';
        StringBuilder sb = new StringBuilder(s.length() + 2);
        sb.append(quote);
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            switch (c) {
                case '\\':
                    sb.append("\\\\");
                    break;
                case '\n':
                    sb.append("\\n");
                    break;
                case '\r':
                    sb.append("\\r");
                    break;
                case '\t':
                    sb.append("\\t");
                    break;
                default:
                    if (c == quote)
                        sb.append('\\').append(c);
                    else if (c < 0x20 || c == 0x7f)
                        sb.append(String.format("\\x%02x", (int) c));
                    else
                        sb.append(c);
            }
        }
        return sb.append(quote).toString();
    }

    /**
     * A triple-quoted docstring. Continuation lines are indented with
     * {@code indent}; empty lines stay empty.
     */
    public static String docstring(String text, String indent) {
        String escaped = text.replace("\\", "\\\\").replace("\"\"\"", "\\\"\\\"\\\"");
        if (escaped.endsWith("\""))
            escaped = escaped.substring(0, escaped.length() - 1) + "\\\"";
        String[] lines = escaped.split("\n", -1);
        StringBuilder sb = new StringBuilder("\"\"\"");
        for (int i = 0; i < lines.length; i++) {
            if (i > 0) {
                sb.append('\n');
                if (!lines[i].isBlank())
                    sb.append(indent);
            }
            sb.append(i > 0 && lines[i].isBlank() ? "" : lines[i]);
        }
        return sb.append("\"\"\"").toString();
    }
}
