package com.nodeflow.vgc.ast;

public record Pass() implements Stmt {
    public static final Pass INSTANCE = new Pass();
}
