package com.nodeflow.vgc.lowering.mapper;

import com.nodeflow.vgc.api.NodeKind;
import com.nodeflow.vgc.api.Port;
import com.nodeflow.vgc.api.Types;
import com.nodeflow.vgc.api.VisualNode;
import com.nodeflow.vgc.codegen.PythonUnparser;
import com.nodeflow.vgc.engine.VisualGraph;
import com.nodeflow.vgc.lowering.ConnectionContext;
import org.junit.Test;

import java.util.List;
import java.util.UUID;

import static org.junit.Assert.*;

public class FunctionMapperTest {
    private final PythonUnparser unparser = new PythonUnparser();

    private static UUID variable(VisualGraph g, String name) {
        return g.addNode(VisualNode.builder().kind(NodeKind.VARIABLE)
                .parameter("variable_name", name)
                .output(Port.output("value", Types.OBJECT))
                .build());
    }

    @Test
    public void testMissingNameFallsBack() {
        assertEquals("unknown_function()",
                unparser.render(new FunctionMapper().lower(VisualNode.of(NodeKind.FUNCTION), ConnectionContext.EMPTY)));
    }

    @Test
    public void testPositionalAndKeywordBindings() {
        VisualGraph g = new VisualGraph();
        VisualNode call = VisualNode.builder().kind(NodeKind.FUNCTION)
                .parameter("function_name", "print")
                .input(Port.input("args", Types.OBJECT))
                .input(Port.optionalInput("sep", Types.STR, " "))
                .input(Port.optionalInput("end", Types.STR, "\n"))
                .build();
        g.addNode(call);
        g.connect(variable(g, "msg"), "value", call.getId(), "args");
        g.connect(variable(g, "separator"), "value", call.getId(), "sep");

        String code = unparser.render(new FunctionMapper().lower(call, ConnectionContext.of(g)));

        assertEquals("print(msg, sep=separator, end='\\n')", code);
    }

    @Test
    public void testDefaultCollectionsBecomeLiterals() {
        VisualNode call = VisualNode.builder().kind(NodeKind.FUNCTION)
                .parameter("function_name", "plot")
                .input(Port.optionalInput("points", Types.LIST, List.of(1, 2.5, "a")))
                .input(Port.optionalInput("flag", Types.BOOL, false))
                .build();

        assertEquals("plot(points=[1, 2.5, 'a'], flag=False)",
                unparser.render(new FunctionMapper().lower(call, ConnectionContext.EMPTY)));
    }
}
