package com.nodeflow.vgc.parse;

import org.junit.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.Assert.*;

public class PythonLexerTest {

    private static List<Token.Type> types(String source) {
        List<Token.Type> types = new ArrayList<>();
        for (Token t : PythonLexer.tokenize(source))
            types.add(t.type());
        return types;
    }

    @Test
    public void testIndentationTokens() {
        assertEquals(List.of(Token.Type.NAME, Token.Type.NAME, Token.Type.OP, Token.Type.NEWLINE,
                Token.Type.INDENT, Token.Type.NAME, Token.Type.NEWLINE, Token.Type.DEDENT, Token.Type.EOF),
                types("if a:\n    b\n"));
    }

    @Test
    public void testBlankAndCommentLinesProduceNothing() {
        assertEquals(List.of(Token.Type.NAME, Token.Type.NEWLINE, Token.Type.EOF),
                types("# header\n\n   \nx  # trailing\n# end"));
    }

    @Test
    public void testBracketsJoinLines() {
        List<Token> tokens = PythonLexer.tokenize("x = (1,\n     2)\ny = 3\n");
        long newlines = tokens.stream().filter(t -> t.type() == Token.Type.NEWLINE).count();
        assertEquals(2, newlines);
        Token y = tokens.stream().filter(t -> t.isKeyword("y")).findFirst().orElseThrow();
        assertEquals(3, y.line());
        assertEquals(1, y.column());
    }

    @Test
    public void testStringsAndNumbers() {
        List<Token> tokens = PythonLexer.tokenize("'a\\nb' r'a\\nb' \"\"\"x\ny\"\"\" 0x1F 1_000 1e3 2.5");
        assertEquals("a\nb", tokens.get(0).value());
        assertEquals("a\\nb", tokens.get(1).value());
        assertEquals("x\ny", tokens.get(2).value());
        assertEquals(31L, tokens.get(3).value());
        assertEquals(1000L, tokens.get(4).value());
        assertEquals(1000.0, tokens.get(5).value());
        assertEquals(2.5, tokens.get(6).value());
    }

    @Test
    public void testLongestOperatorWins() {
        List<Token> tokens = PythonLexer.tokenize("a **= b // c -> d");
        assertTrue(tokens.get(1).isOp("**="));
        assertTrue(tokens.get(3).isOp("//"));
        assertTrue(tokens.get(5).isOp("->"));
    }

    @Test
    public void testUnterminatedString() {
        SourceParseException e = assertThrows(SourceParseException.class,
                () -> PythonLexer.tokenize("x = 1\ny = 'abc\n"));
        assertEquals(2, e.getLine());
        assertEquals(5, e.getColumn());
    }

    @Test
    public void testInconsistentDedent() {
        SourceParseException e = assertThrows(SourceParseException.class,
                () -> PythonLexer.tokenize("if a:\n        b\n    c\n"));
        assertEquals(3, e.getLine());
        assertTrue(e.getMessage().startsWith("unindent does not match"));
    }

    @Test
    public void testInvalidCharacter() {
        assertThrows(SourceParseException.class, () -> PythonLexer.tokenize("x = $"));
    }
}
