package com.nodeflow.vgc.parse;

/**
 * A lexical token.
 *
 * @param text  Source spelling; for strings and numbers {@link #value} holds
 *              the decoded literal.
 * @param value Decoded literal value, or null.
 */
public record Token(Type type, String text, Object value, int line, int column) {

    public enum Type {
        NAME,
        NUMBER,
        STRING,
        OP,
        NEWLINE,
        INDENT,
        DEDENT,
        EOF
    }

    public boolean is(Type t, String s) {
        return type == t && text.equals(s);
    }

    public boolean isOp(String s) {
        return type == Type.OP && text.equals(s);
    }

    public boolean isKeyword(String s) {
        return type == Type.NAME && text.equals(s);
    }

    @Override
    public String toString() {
        return type + "(" + text + ")@" + line + ":" + column;
    }
}
