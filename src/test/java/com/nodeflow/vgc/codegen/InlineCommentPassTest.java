package com.nodeflow.vgc.codegen;

import com.nodeflow.vgc.api.NodeKind;
import com.nodeflow.vgc.api.VisualNode;
import com.nodeflow.vgc.engine.VisualGraph;
import org.junit.Test;

import static org.junit.Assert.*;

public class InlineCommentPassTest {

    @Test
    public void testAppendsFirstVariableComment() {
        VisualGraph g = new VisualGraph();
        g.addNode(VisualNode.builder().kind(NodeKind.VARIABLE)
                .parameter("variable_name", "total")
                .comment("sum of items")
                .comment("ignored")
                .build());
        g.addNode(VisualNode.builder().kind(NodeKind.VARIABLE)
                .parameter("variable_name", "plain")
                .build());
        g.addNode(VisualNode.builder().kind(NodeKind.FUNCTION)
                .parameter("variable_name", "x")
                .parameter("function_name", "f")
                .comment("not a variable")
                .build());

        String code = "total = 0\ntotal += 1\n# total = 3\nplain = 2\nx = total\nprint(total)";

        assertEquals("total = 0  # sum of items\ntotal += 1\n# total = 3\nplain = 2\nx = total\nprint(total)",
                new InlineCommentPass().apply(code, g));
    }

    @Test
    public void testIndentedAssignment() {
        VisualGraph g = new VisualGraph();
        g.addNode(VisualNode.builder().kind(NodeKind.VARIABLE)
                .parameter("variable_name", "n")
                .comment("counter")
                .build());

        assertEquals("def f():\n    n = 1  # counter", new InlineCommentPass().apply("def f():\n    n = 1", g));
    }
}
