package com.nodeflow.vgc.ast;

public record Continue() implements Stmt {
}
