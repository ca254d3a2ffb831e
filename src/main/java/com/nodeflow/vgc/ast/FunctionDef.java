package com.nodeflow.vgc.ast;

import java.util.List;

/**
 * A (possibly async) function definition.
 *
 * @param returns Return annotation, or null.
 */
public record FunctionDef(String name, Arguments args, List<Stmt> body, List<Expr> decorators, Expr returns,
        boolean isAsync) implements Stmt {

    public FunctionDef {
        args = args != null ? args : Arguments.EMPTY;
        body = List.copyOf(body);
        decorators = List.copyOf(decorators);
    }

    /** Plain synchronous function with no decorators and no annotation. */
    public static FunctionDef of(String name, Arguments args, Stmt... body) {
        return new FunctionDef(name, args, List.of(body), List.of(), null, false);
    }

    @Override
    public String kind() {
        return isAsync ? "AsyncFunctionDef" : "FunctionDef";
    }

    public FunctionDef withBody(List<Stmt> newBody) {
        return new FunctionDef(name, args, newBody, decorators, returns, isAsync);
    }

    public FunctionDef withSignature(Arguments newArgs, Expr newReturns) {
        return new FunctionDef(name, newArgs, body, decorators, newReturns, isAsync);
    }

    public FunctionDef withDecorators(List<Expr> newDecorators) {
        return new FunctionDef(name, args, body, newDecorators, returns, isAsync);
    }
}
