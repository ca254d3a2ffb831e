package com.nodeflow.vgc.parse;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Splits Python source into tokens, synthesizing NEWLINE, INDENT and DEDENT
 * from the line structure.
 *
 * <p>
 * Comments and blank lines produce no tokens. Newlines inside brackets and
 * after a trailing backslash join lines. Tabs advance to the next multiple of
 * eight columns.
 */
public final class PythonLexer {
    private static final String[] OPERATORS = {
            "**=", "//=", ">>=", "<<=", "...",
            "->", ":=", "**", "//", "<<", ">>", "<=", ">=", "==", "!=",
            "+=", "-=", "*=", "/=", "%=", "&=", "|=", "^=", "@=",
            "+", "-", "*", "/", "%", "@", "&", "|", "^", "~", "<", ">",
            "(", ")", "[", "]", "{", "}", ",", ":", ".", ";", "=" };

    private final String src;
    private final List<Token> tokens = new ArrayList<>();
    private final Deque<Integer> indents = new ArrayDeque<>();
    private int pos;
    private int line = 1;
    private int lineStart;
    private int depth;

    private PythonLexer(String src) {
        this.src = src;
        indents.push(0);
    }

    public static List<Token> tokenize(String source) {
        PythonLexer lexer = new PythonLexer(source.replace("\r\n", "\n").replace('\r', '\n'));
        lexer.run();
        return lexer.tokens;
    }

    private void run() {
        boolean atLineStart = true;
        while (pos < src.length()) {
            if (atLineStart) {
                if (handleIndentation())
                    continue;
                atLineStart = false;
            }
            char c = src.charAt(pos);
            if (c == '\n') {
                if (depth == 0 && !tokens.isEmpty() && last().type() != Token.Type.NEWLINE)
                    add(Token.Type.NEWLINE, "\n", null, pos);
                newLine();
                atLineStart = depth == 0;
            } else if (c == ' ' || c == '\t' || c == '\f') {
                pos++;
            } else if (c == '#') {
                skipComment();
            } else if (c == '\\') {
                if (pos + 1 < src.length() && src.charAt(pos + 1) == '\n') {
                    pos++;
                    newLine();
                } else {
                    throw error("unexpected character after line continuation character", pos);
                }
            } else if (isStringStart(pos)) {
                readString();
            } else if (Character.isDigit(c) || (c == '.' && pos + 1 < src.length()
                    && Character.isDigit(src.charAt(pos + 1)))) {
                readNumber();
            } else if (Character.isLetter(c) || c == '_') {
                int start = pos;
                while (pos < src.length() && isIdentifierPart(src.charAt(pos)))
                    pos++;
                add(Token.Type.NAME, src.substring(start, pos), null, start);
            } else {
                readOperator();
            }
        }

        if (!tokens.isEmpty() && last().type() != Token.Type.NEWLINE)
            add(Token.Type.NEWLINE, "", null, pos);
        while (indents.peek() > 0) {
            indents.pop();
            add(Token.Type.DEDENT, "", null, pos);
        }
        add(Token.Type.EOF, "", null, pos);
    }

    /**
     * Measures the indentation of the line at {@code pos}. Blank and
     * comment-only lines are consumed entirely and produce no tokens.
     *
     * @return true if the line was skipped.
     */
    private boolean handleIndentation() {
        int width = 0;
        int p = pos;
        while (p < src.length()) {
            char c = src.charAt(p);
            if (c == ' ')
                width++;
            else if (c == '\t')
                width = (width / 8 + 1) * 8;
            else if (c == '\f')
                width = 0;
            else
                break;
            p++;
        }
        if (p >= src.length() || src.charAt(p) == '\n' || src.charAt(p) == '#') {
            pos = p;
            if (pos < src.length() && src.charAt(pos) == '#')
                skipComment();
            if (pos < src.length())
                newLine();
            return true;
        }
        pos = p;

        int current = indents.peek();
        if (width > current) {
            indents.push(width);
            add(Token.Type.INDENT, "", null, pos);
        } else {
            while (width < indents.peek()) {
                indents.pop();
                add(Token.Type.DEDENT, "", null, pos);
            }
            if (width != indents.peek())
                throw error("unindent does not match any outer indentation level", pos);
        }
        return false;
    }

    private void skipComment() {
        while (pos < src.length() && src.charAt(pos) != '\n')
            pos++;
    }

    private void newLine() {
        pos++;
        line++;
        lineStart = pos;
    }

    // ── Strings ────────────────────────────────────────────────────

    private boolean isStringStart(int p) {
        int i = p;
        while (i < src.length() && i - p < 2 && "rRbBuUfF".indexOf(src.charAt(i)) >= 0)
            i++;
        if (i >= src.length())
            return false;
        char q = src.charAt(i);
        return q == '\'' || q == '"';
    }

    private void readString() {
        int start = pos;
        int startLine = line;
        int startColumn = pos - lineStart + 1;
        boolean raw = false;
        while ("rRbBuUfF".indexOf(src.charAt(pos)) >= 0) {
            if (src.charAt(pos) == 'r' || src.charAt(pos) == 'R')
                raw = true;
            pos++;
        }
        char quote = src.charAt(pos);
        boolean triple = src.startsWith(String.valueOf(quote).repeat(3), pos);
        pos += triple ? 3 : 1;

        StringBuilder value = new StringBuilder();
        while (true) {
            if (pos >= src.length())
                throw new SourceParseException("unterminated string literal", startLine, startColumn);
            char c = src.charAt(pos);
            if (triple && src.startsWith(String.valueOf(quote).repeat(3), pos)) {
                pos += 3;
                break;
            }
            if (!triple && c == quote) {
                pos++;
                break;
            }
            if (c == '\n') {
                if (!triple)
                    throw new SourceParseException("unterminated string literal", startLine, startColumn);
                value.append(c);
                newLine();
                continue;
            }
            if (c == '\\' && pos + 1 < src.length()) {
                char n = src.charAt(pos + 1);
                if (n == '\n') {
                    if (raw)
                        value.append("\\\n");
                    pos++;
                    newLine();
                    continue;
                }
                if (raw) {
                    value.append(c).append(n);
                    pos += 2;
                    continue;
                }
                pos += 2;
                value.append(escape(n));
                continue;
            }
            value.append(c);
            pos++;
        }
        tokens.add(new Token(Token.Type.STRING, src.substring(start, pos), value.toString(), startLine,
                startColumn));
    }

    private String escape(char n) {
        switch (n) {
            case 'n':
                return "\n";
            case 't':
                return "\t";
            case 'r':
                return "\r";
            case '0':
                return "\0";
            case 'a':
                return "\u0007";
            case 'b':
                return "\b";
            case 'f':
                return "\f";
            case 'v':
                return "\u000b";
            case 'x':
                return String.valueOf((char) hex(2));
            case 'u':
                return String.valueOf((char) hex(4));
            case 'U':
                return new String(Character.toChars(hex(8)));
            case '\\':
            case '\'':
            case '"':
                return String.valueOf(n);
            default:
                return "\\" + n;
        }
    }

    private int hex(int digits) {
        if (pos + digits > src.length())
            throw error("truncated escape sequence", pos);
        try {
            int v = Integer.parseInt(src.substring(pos, pos + digits), 16);
            pos += digits;
            return v;
        } catch (NumberFormatException e) {
            throw error("invalid escape sequence", pos);
        }
    }

    // ── Numbers ────────────────────────────────────────────────────

    private void readNumber() {
        int start = pos;
        if (src.charAt(pos) == '0' && pos + 1 < src.length() && "xXoObB".indexOf(src.charAt(pos + 1)) >= 0) {
            char base = Character.toLowerCase(src.charAt(pos + 1));
            pos += 2;
            while (pos < src.length() && (Character.isLetterOrDigit(src.charAt(pos)) || src.charAt(pos) == '_'))
                pos++;
            String digits = src.substring(start + 2, pos).replace("_", "");
            int radix = base == 'x' ? 16 : base == 'o' ? 8 : 2;
            try {
                add(Token.Type.NUMBER, src.substring(start, pos), Long.parseLong(digits, radix), start);
            } catch (NumberFormatException e) {
                throw error("invalid number literal", start);
            }
            return;
        }

        boolean isFloat = false;
        digits();
        if (pos < src.length() && src.charAt(pos) == '.') {
            isFloat = true;
            pos++;
            digits();
        }
        if (pos < src.length() && (src.charAt(pos) == 'e' || src.charAt(pos) == 'E')) {
            int save = pos;
            pos++;
            if (pos < src.length() && (src.charAt(pos) == '+' || src.charAt(pos) == '-'))
                pos++;
            if (pos < src.length() && Character.isDigit(src.charAt(pos))) {
                isFloat = true;
                digits();
            } else {
                pos = save;
            }
        }
        String text = src.substring(start, pos).replace("_", "");
        if (pos < src.length() && (src.charAt(pos) == 'j' || src.charAt(pos) == 'J')) {
            pos++;
            isFloat = true;
        }
        if (pos < src.length() && isIdentifierPart(src.charAt(pos)))
            throw error("invalid decimal literal", start);

        Object value;
        if (isFloat) {
            value = Double.parseDouble(text);
        } else {
            try {
                value = Long.parseLong(text);
            } catch (NumberFormatException e) {
                value = Double.parseDouble(text);
            }
        }
        add(Token.Type.NUMBER, src.substring(start, pos), value, start);
    }

    private void digits() {
        while (pos < src.length() && (Character.isDigit(src.charAt(pos)) || src.charAt(pos) == '_'))
            pos++;
    }

    // ── Operators ──────────────────────────────────────────────────

    private void readOperator() {
        for (String op : OPERATORS) {
            if (src.startsWith(op, pos)) {
                if (op.equals("(") || op.equals("[") || op.equals("{"))
                    depth++;
                else if (op.equals(")") || op.equals("]") || op.equals("}"))
                    depth = Math.max(0, depth - 1);
                add(Token.Type.OP, op, null, pos);
                pos += op.length();
                return;
            }
        }
        throw error("invalid character '" + src.charAt(pos) + "'", pos);
    }

    private static boolean isIdentifierPart(char c) {
        return Character.isLetterOrDigit(c) || c == '_';
    }

    private Token last() {
        return tokens.get(tokens.size() - 1);
    }

    private void add(Token.Type type, String text, Object value, int at) {
        tokens.add(new Token(type, text, value, line, at - lineStart + 1));
    }

    private SourceParseException error(String message, int at) {
        return new SourceParseException(message, line, at - lineStart + 1);
    }
}
