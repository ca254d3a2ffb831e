package com.nodeflow.vgc.ast;

public record Break() implements Stmt {
}
