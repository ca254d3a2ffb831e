package com.nodeflow.vgc.dsl;

import com.nodeflow.vgc.api.NodeKind;
import com.nodeflow.vgc.api.Port;
import com.nodeflow.vgc.api.Types;
import com.nodeflow.vgc.api.VisualNode;
import com.nodeflow.vgc.codegen.PythonUnparser;
import com.nodeflow.vgc.engine.VisualGraph;
import com.nodeflow.vgc.lowering.GraphLowering;
import org.junit.Test;

import java.util.List;
import java.util.Map;

import static org.junit.Assert.*;

public class GraphBuilderTest {

    @Test
    public void testBuildAndLower() {
        GraphBuilder b = GraphBuilder.create("demo");
        VisualGraph g = b
                .function("show", "print", Port.input("args", Types.OBJECT))
                .variable("x", 10L)
                .connect("x", GraphBuilder.VALUE_PORT, "show", "args")
                .build();

        assertEquals(2, g.nodeCount());
        assertEquals("demo", g.metadata().get("name"));
        assertEquals(List.of(b.id("x"), b.id("show")), g.executionOrder());
        assertEquals("x = 10\nprint(x)", new PythonUnparser().unparse(new GraphLowering().lower(g)));
    }

    @Test
    public void testAnnotations() {
        GraphBuilder b = GraphBuilder.create("demo")
                .classNode("shape", "Shape", "abstract")
                .comment("shape", "Base of all shapes")
                .docstring("shape", "A shape.")
                .position("shape", 10, 20)
                .metadata("author", "me");
        VisualGraph g = b.build();

        VisualNode shape = g.node(b.id("shape")).orElseThrow();
        assertEquals("shape", shape.getName());
        assertEquals(List.of("Base of all shapes"), shape.getComments());
        assertEquals("A shape.", shape.getDocstring());
        assertEquals(new VisualNode.Position(10, 20), shape.getPosition());
        assertEquals("me", g.metadata().get("author"));
    }

    @Test
    public void testExternalAndGenericNodes() {
        VisualNode external = VisualNode.of(NodeKind.ASYNC);
        GraphBuilder b = GraphBuilder.create("demo")
                .node("fetch", external)
                .node("gen", NodeKind.GENERATOR, Map.of("function_name", "numbers"))
                .control("loop", "while");
        VisualGraph g = b.build();

        assertEquals(external.getId(), b.id("fetch"));
        assertEquals("fetch", external.getName());
        assertEquals("numbers", g.node(b.id("gen")).orElseThrow().parameter("function_name"));
        assertEquals("while", g.node(b.id("loop")).orElseThrow().parameter("control_type"));
    }

    @Test
    public void testFailFast() {
        GraphBuilder b = GraphBuilder.create("demo")
                .variable("x", "text")
                .variable("n", 1L);

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> b.variable("x", 2L));
        assertEquals("Duplicate node label: x", e.getMessage());

        e = assertThrows(IllegalArgumentException.class, () -> b.id("ghost"));
        assertEquals("Unknown node label: ghost", e.getMessage());

        // str into int
        e = assertThrows(IllegalArgumentException.class, () -> b.connect("x", "value", "n", "value"));
        assertEquals("Cannot connect x.value -> n.value", e.getMessage());
    }

    @Test
    public void testNoChangesAfterBuild() {
        GraphBuilder b = GraphBuilder.create("demo").variable("x", 1L);
        b.build();

        assertThrows(IllegalStateException.class, b::build);
        assertThrows(IllegalStateException.class, () -> b.variable("y", 2L));
        assertThrows(IllegalStateException.class, () -> b.comment("x", "late"));
        assertThrows(IllegalStateException.class, () -> b.metadata("k", "v"));
    }

    @Test
    public void testTypeOf() {
        assertEquals(Types.BOOL, GraphBuilder.typeOf(true));
        assertEquals(Types.INT, GraphBuilder.typeOf(3));
        assertEquals(Types.INT, GraphBuilder.typeOf(3L));
        assertEquals(Types.FLOAT, GraphBuilder.typeOf(2.5f));
        assertEquals(Types.STR, GraphBuilder.typeOf("s"));
        assertEquals(Types.LIST, GraphBuilder.typeOf(List.of()));
        assertEquals(Types.DICT, GraphBuilder.typeOf(Map.of()));
        assertEquals(Types.NONE, GraphBuilder.typeOf(null));
        assertEquals(Types.OBJECT, GraphBuilder.typeOf(new Object()));
    }
}
