package com.nodeflow.vgc.codegen;

import com.nodeflow.vgc.ast.Alias;
import com.nodeflow.vgc.ast.Arg;
import com.nodeflow.vgc.ast.Arguments;
import com.nodeflow.vgc.ast.Assign;
import com.nodeflow.vgc.ast.Attribute;
import com.nodeflow.vgc.ast.BinOp;
import com.nodeflow.vgc.ast.BoolOp;
import com.nodeflow.vgc.ast.Call;
import com.nodeflow.vgc.ast.Comment;
import com.nodeflow.vgc.ast.Compare;
import com.nodeflow.vgc.ast.Comprehension;
import com.nodeflow.vgc.ast.Constant;
import com.nodeflow.vgc.ast.ExceptHandler;
import com.nodeflow.vgc.ast.Expr;
import com.nodeflow.vgc.ast.ExprStmt;
import com.nodeflow.vgc.ast.For;
import com.nodeflow.vgc.ast.FunctionDef;
import com.nodeflow.vgc.ast.GeneratorExp;
import com.nodeflow.vgc.ast.If;
import com.nodeflow.vgc.ast.IfExp;
import com.nodeflow.vgc.ast.ImportFrom;
import com.nodeflow.vgc.ast.Lambda;
import com.nodeflow.vgc.ast.Module;
import com.nodeflow.vgc.ast.Name;
import com.nodeflow.vgc.ast.Pass;
import com.nodeflow.vgc.ast.Slice;
import com.nodeflow.vgc.ast.Subscript;
import com.nodeflow.vgc.ast.Try;
import com.nodeflow.vgc.ast.TupleExpr;
import com.nodeflow.vgc.ast.UnaryOp;
import com.nodeflow.vgc.ast.While;
import org.junit.Test;

import java.util.List;

import static org.junit.Assert.*;

public class PythonUnparserTest {
    private final PythonUnparser unparser = new PythonUnparser();

    private static Name n(String id) {
        return new Name(id);
    }

    private String expr(Expr e) {
        return unparser.expression(e);
    }

    @Test
    public void testMinimalParentheses() {
        assertEquals("(a + b) * c", expr(new BinOp(new BinOp(n("a"), "+", n("b")), "*", n("c"))));
        assertEquals("a + b * c", expr(new BinOp(n("a"), "+", new BinOp(n("b"), "*", n("c")))));
        assertEquals("a - (b - c)", expr(new BinOp(n("a"), "-", new BinOp(n("b"), "-", n("c")))));
        assertEquals("a - b - c", expr(new BinOp(new BinOp(n("a"), "-", n("b")), "-", n("c"))));
        assertEquals("a ** b ** c", expr(new BinOp(n("a"), "**", new BinOp(n("b"), "**", n("c")))));
        assertEquals("(a ** b) ** c", expr(new BinOp(new BinOp(n("a"), "**", n("b")), "**", n("c"))));
        assertEquals("not (a or b)", expr(UnaryOp.not(new BoolOp("or", List.of(n("a"), n("b"))))));
        assertEquals("(a or b) and c", expr(new BoolOp("and",
                List.of(new BoolOp("or", List.of(n("a"), n("b"))), n("c")))));
        assertEquals("-(a + b)", expr(new UnaryOp("-", new BinOp(n("a"), "+", n("b")))));
    }

    @Test
    public void testNumericAttributeBase() {
        assertEquals("(1).real", expr(new Attribute(Constant.of(1), "real")));
        assertEquals("(-1.5).real", expr(new Attribute(Constant.of(-1.5), "real")));
        assertEquals("2.5.real", expr(new Attribute(Constant.of(2.5), "real")));
        assertEquals("(-2) ** 2", expr(new BinOp(Constant.of(-2), "**", Constant.of(2))));
    }

    @Test
    public void testExpressionForms() {
        assertEquals("a < b <= c", expr(new Compare(n("a"), List.of("<", "<="), List.of(n("b"), n("c")))));
        assertEquals("x if c else y", expr(new IfExp(n("c"), n("x"), n("y"))));
        assertEquals("lambda x, y=1: x", expr(new Lambda(
                new Arguments(List.of(Arg.of("x"), new Arg("y", null, Constant.of(1))), null, List.of(), null),
                n("x"))));
        assertEquals("sum(x for x in xs)", expr(Call.of("sum", new GeneratorExp(n("x"),
                List.of(new Comprehension(n("x"), n("xs"), List.of(), false))))));
        assertEquals("a[1:2]", expr(new Subscript(n("a"), new Slice(Constant.of(1), Constant.of(2), null))));
        assertEquals("a[::2]", expr(new Subscript(n("a"), new Slice(null, null, Constant.of(2)))));
        assertEquals("a[i, j]", expr(new Subscript(n("a"), new TupleExpr(List.of(n("i"), n("j"))))));
        assertEquals("()", expr(new TupleExpr(List.of())));
        assertEquals("x = (1,)", unparser.render(Assign.of("x", new TupleExpr(List.of(Constant.of(1))))));
    }

    @Test
    public void testModuleDocstringAndBlankLines() {
        Module m = Module.of(
                new ExprStmt(Constant.of("Module doc.")),
                Assign.of("x", Constant.of(1)),
                FunctionDef.of("f", Arguments.EMPTY, Pass.INSTANCE),
                Assign.of("y", Constant.of(2)));

        assertEquals("\"\"\"Module doc.\"\"\"\nx = 1\n\ndef f():\n    pass\ny = 2", unparser.unparse(m));
    }

    @Test
    public void testElifChainAndElse() {
        If inner = new If(n("b"), List.of(Pass.INSTANCE), List.of(Assign.of("z", Constant.NONE)));
        If outer = new If(n("a"), List.of(Pass.INSTANCE), List.of(inner));

        assertEquals("if a:\n    pass\nelif b:\n    pass\nelse:\n    z = None", unparser.render(outer));
    }

    @Test
    public void testTryAndLoops() {
        Try t = new Try(List.of(Pass.INSTANCE),
                List.of(new ExceptHandler(n("ValueError"), "e", List.of(Pass.INSTANCE)),
                        new ExceptHandler(null, null, List.of(Pass.INSTANCE))),
                List.of(Pass.INSTANCE), List.of(Pass.INSTANCE));
        assertEquals("try:\n    pass\nexcept ValueError as e:\n    pass\nexcept:\n    pass\n"
                + "else:\n    pass\nfinally:\n    pass", unparser.render(t));

        For f = new For(new TupleExpr(List.of(n("k"), n("v"))), Call.of(new Attribute(n("d"), "items")),
                List.of(Pass.INSTANCE), List.of(), false);
        assertEquals("for k, v in d.items():\n    pass", unparser.render(f));

        While w = new While(Constant.TRUE, List.of(), List.of(Pass.INSTANCE));
        assertEquals("while True:\n    pass\nelse:\n    pass", unparser.render(w));
    }

    @Test
    public void testCommentOnlyBodyGetsPass() {
        FunctionDef f = FunctionDef.of("f", Arguments.EMPTY, new Comment("nothing yet"));
        assertEquals("def f():\n    # nothing yet\n    pass", unparser.render(f));
    }

    @Test
    public void testImportFromLevels() {
        assertEquals("from ..pkg import a as b", unparser.render(
                new ImportFrom("pkg", List.of(new Alias("a", "b")), 2)));
    }

    @Test
    public void testUnknownNodesThrow() {
        assertThrows(IllegalStateException.class, () -> expr(new BinOp(n("a"), "<>", n("b"))));
        assertThrows(IllegalStateException.class, () -> unparser.unparse(Module.of(Assign.of("x", null))));
        assertThrows(IllegalStateException.class, () -> unparser.unparse(null));
    }
}
