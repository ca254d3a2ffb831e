package com.nodeflow.vgc.ast;

import java.util.List;

public record Delete(List<Expr> targets) implements Stmt {

    public Delete {
        targets = List.copyOf(targets);
    }
}
