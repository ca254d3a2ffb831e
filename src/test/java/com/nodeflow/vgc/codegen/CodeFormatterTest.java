package com.nodeflow.vgc.codegen;

import org.junit.Test;

import static org.junit.Assert.*;

public class CodeFormatterTest {
    private final CodeFormatter formatter = new CodeFormatter();

    @Test
    public void testBlankLineBeforeDefinitions() {
        assertEquals("x = 1\n\ndef f():\n    pass\n\nclass A:\n    pass",
                formatter.format("x = 1\ndef f():\n    pass\nclass A:\n    pass"));
        assertEquals("x = 1\n\nasync def g():\n    pass", formatter.format("x = 1\nasync def g():\n    pass"));
    }

    @Test
    public void testBlankLineAfterDecorator() {
        assertEquals("@dataclass\n\nclass X:\n    pass", formatter.format("@dataclass\nclass X:\n    pass"));
        assertEquals("class A:\n    @property\n\n    def x(self):\n        pass",
                formatter.format("class A:\n    @property\n    def x(self):\n        pass"));
    }

    @Test
    public void testNoBlankLineAfterBlankOrAtStart() {
        String code = "x = 1\n\ndef g():\n    pass";
        assertEquals(code, formatter.format(code));
        assertEquals("def first():\n    pass", formatter.format("def first():\n    pass"));
    }

    @Test
    public void testIndentationAndTrailingWhitespace() {
        assertEquals("if x:\n    y = 1\n        z = 2\nw = 3",
                formatter.format("if x:   \n     y = 1\n        z = 2\t\n   w = 3"));
        assertEquals("a\n\nb", formatter.format("a\n   \nb"));
    }
}
