package com.nodeflow.vgc;

import com.nodeflow.vgc.api.NodeKind;
import com.nodeflow.vgc.api.ValidationError;
import com.nodeflow.vgc.api.VisualNode;
import com.nodeflow.vgc.engine.VisualGraph;
import com.nodeflow.vgc.lowering.MapperRegistry;
import org.junit.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.Assert.*;

public class VisualCompilerTest {
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-01-02T03:04:05Z"), ZoneOffset.UTC);

    private final VisualCompiler compiler = new VisualCompiler(new MapperRegistry(), CLOCK);

    @Test
    public void testCompileSample() {
        VisualGraph g = compiler.getLoader().loadResource(VisualCompiler.SAMPLE_GRAPH).graph();

        VisualCompiler.CompilationResult result = compiler.compile(g);
        String code = result.code();

        assertTrue(result.isClean());
        assertTrue(code.startsWith("# Sample visual program\n"
                + "# Author: NodeFlow\n"
                + "# Version: 1.0\n"
                + "# Generated on: 2024-01-02 03:04:05\n"
                + "\n"
                + "greeting = 'Hello, world'  # Text shown to the user\n"
                + "count = 3\n"));
        assertTrue(code.contains("@dataclass\n\nclass Point:\n    \"\"\"A point on the canvas.\"\"\"\n"));
        assertTrue(code.contains("    x: int\n    y: int\n"));
        assertTrue(code.contains("@staticmethod\n\ndef handle() -> Any:\n    \"\"\"Handle one event.\"\"\"\n    pass\n"));
        assertTrue(code.contains("print(greeting, sep=' ')\n"));
        assertTrue(code.endsWith("for i in count:\n    pass"));
        assertTrue(code.indexOf("class Point") < code.indexOf("def handle"));
        assertTrue(code.indexOf("def handle") < code.indexOf("print("));
        assertFalse(code.contains("\n\n\n"));

        assertEquals(code.split("\n", -1).length, result.metrics().totalLines());
        assertTrue(result.metrics().commentLines() >= 4);
    }

    @Test
    public void testCompileJsonString() {
        String json = ("{'graph': {'name': 'tiny', 'nodes': ["
                + "{'name': 'x', 'kind': 'variable', 'parameters': {'variable_name': 'x', 'default_value': 2}}"
                + "]}}").replace('\'', '"');

        VisualCompiler.CompilationResult result = compiler.compileJson(json);

        assertTrue(result.isClean());
        assertEquals("# Generated on: 2024-01-02 03:04:05\n\nx = 2", result.code());
    }

    @Test
    public void testGraphErrorsAreReportedNotThrown() {
        VisualGraph g = new VisualGraph();
        g.addNode(VisualNode.of(NodeKind.FUNCTION));

        VisualCompiler.CompilationResult result = compiler.compile(g);

        assertFalse(result.isClean());
        assertEquals(1, result.graphErrors().size());
        assertEquals(ValidationError.Category.MISSING_PARAMETER, result.graphErrors().get(0).category());
        assertEquals("# Generated on: 2024-01-02 03:04:05\n\nunknown_function()", result.code());
        assertTrue(result.validation().valid());
    }

    @Test
    public void testLift() {
        VisualGraph g = compiler.lift("x = 1\nprint(x)\n");
        assertEquals(2, g.nodeCount());
        assertTrue(compiler.getLifting().validateRoundTrip(g));
    }
}
