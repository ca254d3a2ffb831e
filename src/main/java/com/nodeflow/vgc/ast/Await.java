package com.nodeflow.vgc.ast;

public record Await(Expr value) implements Expr {
}
