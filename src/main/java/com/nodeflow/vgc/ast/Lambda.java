package com.nodeflow.vgc.ast;

public record Lambda(Arguments args, Expr body) implements Expr {
}
