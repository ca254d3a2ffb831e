package com.nodeflow.vgc.ast;

public record YieldFrom(Expr value) implements Expr {
}
