package com.nodeflow.vgc.codegen;

import com.nodeflow.vgc.api.NodeKind;
import com.nodeflow.vgc.api.VisualNode;
import com.nodeflow.vgc.ast.Arguments;
import com.nodeflow.vgc.ast.Assign;
import com.nodeflow.vgc.ast.BinOp;
import com.nodeflow.vgc.ast.Constant;
import com.nodeflow.vgc.ast.ExprStmt;
import com.nodeflow.vgc.ast.FunctionDef;
import com.nodeflow.vgc.ast.Module;
import com.nodeflow.vgc.ast.Name;
import com.nodeflow.vgc.ast.Return;
import com.nodeflow.vgc.engine.VisualGraph;
import com.nodeflow.vgc.lowering.GraphLowering;
import org.junit.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.junit.Assert.*;

public class CodeGeneratorTest {
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-01-02T03:04:05Z"), ZoneOffset.UTC);

    private final CodeGenerator generator = new CodeGenerator(CLOCK);

    private static final GeneratorOptions ALL_OFF = GeneratorOptions.builder()
            .addTypeHints(false).addDocstrings(false).preserveComments(false)
            .formatCode(false).optimizeCode(false).build();

    @Test
    public void testDefaultPipelineWithoutGraph() {
        Module m = Module.of(FunctionDef.of("greet", Arguments.of("name"), new Return(new Name("name"))));

        String code = generator.generate(m);

        assertEquals("def greet(name: Any) -> Any:\n"
                + "    \"\"\"Function greet.\n"
                + "\n"
                + "    Args:\n"
                + "        name (Any): Description of name.\n"
                + "\n"
                + "    Returns:\n"
                + "        Any: Description of return value.\"\"\"\n"
                + "    return name", code);
        assertTrue(generator.validate(code).valid());
        // the input tree is untouched
        assertNull(((FunctionDef) m.body().get(0)).returns());
    }

    @Test
    public void testAllPassesOff() {
        Module m = Module.of(FunctionDef.of("greet", Arguments.of("name"), new Return(new Name("name"))));
        assertEquals("def greet(name):\n    return name", generator.generate(m, ALL_OFF));
    }

    @Test
    public void testGraphPassesAndHeader() {
        VisualGraph g = new VisualGraph(Map.of("description", "Demo", "author", "Ada", "version", "1.0"));
        g.addNode(VisualNode.builder().kind(NodeKind.VARIABLE)
                .parameter("variable_name", "count")
                .parameter("default_value", 3)
                .comment("Loop bound")
                .build());
        g.addNode(VisualNode.builder().kind(NodeKind.DECORATOR)
                .parameter("decorator_type", "decorated_function")
                .parameter("decorator_name", "staticmethod")
                .parameter("function_name", "handle")
                .comment("Handles events.")
                .build());
        g.addNode(VisualNode.builder().kind(NodeKind.CLASS)
                .parameter("class_name", "Point")
                .docstring("A point.")
                .build());

        String code = generator.generate(new GraphLowering().lower(g), GeneratorOptions.DEFAULTS, g);

        assertEquals("# Demo\n"
                + "# Author: Ada\n"
                + "# Version: 1.0\n"
                + "# Generated on: 2024-01-02 03:04:05\n"
                + "\n"
                + "count = 3  # Loop bound\n"
                + "\n"
                + "@staticmethod\n"
                + "\n"
                + "def handle() -> Any:\n"
                + "    \"\"\"Handles events.\"\"\"\n"
                + "    pass\n"
                + "\n"
                + "class Point:\n"
                + "    \"\"\"A point.\"\"\"\n"
                + "    pass", code);
        assertFalse(code.contains("\n\n\n"));
    }

    @Test
    public void testPreserveCommentsOffKeepsSynthesizedDocstrings() {
        VisualGraph g = new VisualGraph();
        g.addNode(VisualNode.builder().kind(NodeKind.FUNCTION)
                .parameter("function_name", "run")
                .comment("ignored")
                .build());
        Module m = Module.of(FunctionDef.of("run", Arguments.EMPTY));

        String code = generator.generate(m, GeneratorOptions.DEFAULTS.toBuilder().preserveComments(false).build(), g);

        assertTrue(code.contains("\"\"\"Function run."));
        assertFalse(code.contains("ignored"));
    }

    @Test
    public void testFallbackWhenRenderingFails() {
        Module m = Module.of(Assign.of("x", Constant.of(1)),
                new ExprStmt(new BinOp(new Name("a"), "<>", new Name("b"))));

        assertEquals("x = 1\n# ExprStmt", generator.generate(m));
    }

    @Test
    public void testImportsHoisted() {
        Module m = com.nodeflow.vgc.parse.PythonParser.parse("x = 1\nimport sys\nimport abc\n");
        assertEquals("import abc\nimport sys\n\nx = 1", generator.generate(m));
    }

    @Test
    public void testEveryBuiltInShapeParses() {
        VisualGraph g = new VisualGraph(Map.of("description", "All shapes"));
        add(g, NodeKind.VARIABLE, "variable_name", "v", "default_value", "text");
        add(g, NodeKind.FUNCTION, "function_name", "print");
        for (String t : List.of("if", "for", "while", "try", "with", "other"))
            add(g, NodeKind.CONTROL_FLOW, "control_type", t);
        for (String t : List.of("basic", "abstract", "dataclass", "singleton"))
            add(g, NodeKind.CLASS, "class_type", t, "class_name", "C_" + t);
        for (String t : List.of("reference", "decorated_function", "decorator_definition"))
            add(g, NodeKind.DECORATOR, "decorator_type", t, "decorator_name", "deco_" + t);
        for (String t : List.of("await", "async_function", "async_for", "async_with"))
            add(g, NodeKind.ASYNC, "async_type", t);
        for (String t : List.of("yield", "yield_from", "generator_function", "list_comprehension",
                "iterator_protocol"))
            add(g, NodeKind.GENERATOR, "generator_type", t);
        for (String t : List.of("class_with_metaclass", "metaclass_definition"))
            add(g, NodeKind.METACLASS, "metaclass_type", t);
        add(g, NodeKind.IMPORT);

        String code = generator.generate(new GraphLowering().lower(g), GeneratorOptions.DEFAULTS, g);
        CodeValidator.Result result = generator.validate(code);

        assertTrue(String.join("\n", result.errors()) + "\n" + code, result.valid());
        assertTrue(code.contains("# Unsupported node type: import"));
        assertFalse(code.contains("\n\n\n"));
    }

    private static void add(VisualGraph g, NodeKind kind, Object... params) {
        VisualNode.VisualNodeBuilder b = VisualNode.builder().kind(kind);
        for (int i = 0; i < params.length; i += 2)
            b.parameter((String) params[i], params[i + 1]);
        g.addNode(b.build());
    }
}
