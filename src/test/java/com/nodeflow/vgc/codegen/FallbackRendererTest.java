package com.nodeflow.vgc.codegen;

import com.nodeflow.vgc.ast.Arguments;
import com.nodeflow.vgc.ast.Assign;
import com.nodeflow.vgc.ast.Call;
import com.nodeflow.vgc.ast.ClassDef;
import com.nodeflow.vgc.ast.Comment;
import com.nodeflow.vgc.ast.Constant;
import com.nodeflow.vgc.ast.ExprStmt;
import com.nodeflow.vgc.ast.FunctionDef;
import com.nodeflow.vgc.ast.Module;
import com.nodeflow.vgc.ast.Name;
import com.nodeflow.vgc.ast.Pass;
import org.junit.Test;

import java.util.List;

import static org.junit.Assert.*;

public class FallbackRendererTest {
    private final FallbackRenderer renderer = new FallbackRenderer();

    @Test
    public void testLinePerStatement() {
        Module m = Module.of(
                Assign.of("x", Constant.of("hi")),
                Assign.of("y", Call.of("compute")),
                new ExprStmt(Call.of("run", new Name("x"))),
                FunctionDef.of("f", Arguments.of("a"), Pass.INSTANCE),
                new FunctionDef("g", Arguments.EMPTY, List.of(Pass.INSTANCE), List.of(), null, true),
                ClassDef.of("C", List.of(new Name("Base")), Pass.INSTANCE),
                new Comment("a\nb"),
                Pass.INSTANCE);

        assertEquals("x = 'hi'\n"
                + "y = ...  # complex expression\n"
                + "run()\n"
                + "def f():\n"
                + "    pass\n"
                + "# AsyncFunctionDef\n"
                + "class C:\n"
                + "    pass\n"
                + "# a\n"
                + "# b\n"
                + "# Pass", renderer.render(m));
    }

    @Test
    public void testEmptyModule() {
        assertEquals("# Empty module", renderer.render(Module.of()));
    }
}
