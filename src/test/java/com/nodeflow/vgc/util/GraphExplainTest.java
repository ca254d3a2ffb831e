package com.nodeflow.vgc.util;

import com.nodeflow.vgc.api.Connection;
import com.nodeflow.vgc.api.NodeKind;
import com.nodeflow.vgc.api.Port;
import com.nodeflow.vgc.api.Types;
import com.nodeflow.vgc.api.VisualNode;
import com.nodeflow.vgc.dsl.GraphBuilder;
import com.nodeflow.vgc.engine.VisualGraph;
import org.junit.Test;

import java.util.UUID;

import static org.junit.Assert.*;

public class GraphExplainTest {

    private static String mermaidId(UUID id) {
        return "n" + id.toString().replace("-", "").substring(0, 12);
    }

    @Test
    public void testDumpTopology() {
        GraphBuilder b = GraphBuilder.create("demo")
                .function("show", "print", Port.input("args", Types.OBJECT))
                .variable("x", 1L)
                .connect("x", "value", "show", "args");
        VisualGraph g = b.build();
        VisualNode x = g.node(b.id("x")).orElseThrow();
        VisualNode show = g.node(b.id("show")).orElseThrow();

        String dump = new GraphExplain(g).dumpTopology();

        assertEquals("Graph (2 nodes, 1 connections):\n"
                + "  [0] variable[" + x.shortId() + " x] (SRC) -> function[" + show.shortId() + " show].args\n"
                + "  [1] function[" + show.shortId() + " show]\n", dump);
    }

    @Test
    public void testCyclicGraphIsMarked() {
        VisualGraph g = new VisualGraph();
        UUID a = g.addNode(VisualNode.of(NodeKind.VARIABLE));
        UUID b = g.addNode(VisualNode.of(NodeKind.VARIABLE));
        g.addConnection(Connection.between(a, "out", b, "in"));
        g.addConnection(Connection.between(b, "out", a, "in"));

        String dump = new GraphExplain(g).dumpTopology();

        assertTrue(dump.startsWith("Graph (2 nodes, 2 connections, UNORDERABLE):\n"));
        // falls back to insertion order
        assertTrue(dump.contains("  [0] variable[" + a.toString().substring(0, 8) + "]"));
        assertFalse(dump.contains("(SRC)"));
    }

    @Test
    public void testEmptyGraph() {
        assertEquals("Graph (0 nodes, 0 connections):\n", new GraphExplain(new VisualGraph()).dumpTopology());
        assertEquals("graph TD;\n", new GraphExplain(new VisualGraph()).toMermaid());
    }

    @Test
    public void testMermaid() {
        GraphBuilder b = GraphBuilder.create("demo")
                .variable("x", 1L)
                .function("show", "print", Port.input("args", Types.OBJECT))
                .connect("x", "value", "show", "args");
        VisualGraph g = b.build();
        g.addNode(VisualNode.of(NodeKind.IMPORT));

        String mermaid = new GraphExplain(g).toMermaid();

        String x = mermaidId(b.id("x"));
        String show = mermaidId(b.id("show"));
        assertTrue(mermaid.startsWith("graph TD;\n"));
        assertTrue(mermaid.contains("  " + x + "[\"variable: x\"];\n"));
        assertTrue(mermaid.contains("  " + show + "[\"function: print\"];\n"));
        assertTrue(mermaid.contains("[\"import\"];\n"));
        assertTrue(mermaid.endsWith("  " + x + " -- \"value -#gt; args\" --> " + show + ";\n"));
    }
}
