package com.nodeflow.vgc.parse;

/**
 * Raised when source text is not syntactically valid for the parser.
 * Line and column are 1-based.
 */
public class SourceParseException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    private final int line;
    private final int column;

    public SourceParseException(String message, int line, int column) {
        super(message + " (line " + line + ", column " + column + ")");
        this.line = line;
        this.column = column;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }
}
