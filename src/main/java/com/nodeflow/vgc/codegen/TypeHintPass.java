package com.nodeflow.vgc.codegen;

import java.util.ArrayList;
import java.util.List;

import com.nodeflow.vgc.ast.Arg;
import com.nodeflow.vgc.ast.Arguments;
import com.nodeflow.vgc.ast.AstTransformer;
import com.nodeflow.vgc.ast.Expr;
import com.nodeflow.vgc.ast.FunctionDef;
import com.nodeflow.vgc.ast.Name;
import com.nodeflow.vgc.ast.Stmt;

/**
 * Annotates every unannotated positional and keyword-only parameter, and
 * every missing return type, with {@code Any}. Existing annotations are kept.
 */
public final class TypeHintPass extends AstTransformer {
    static final String ANY = "Any";

    @Override
    protected Stmt visitFunctionDef(FunctionDef function) {
        Arguments a = function.args();
        Arguments hinted = new Arguments(hint(a.args()), a.vararg(), hint(a.kwonlyargs()), a.kwarg());
        Expr returns = function.returns() != null ? function.returns() : new Name(ANY);
        return function.withSignature(hinted, returns);
    }

    private static List<Arg> hint(List<Arg> args) {
        List<Arg> out = new ArrayList<>(args.size());
        for (Arg arg : args)
            out.add(arg.annotation() != null ? arg : arg.withAnnotation(new Name(ANY)));
        return out;
    }
}
