package com.nodeflow.vgc.ast;

import java.util.List;

public record Try(List<Stmt> body, List<ExceptHandler> handlers, List<Stmt> orelse, List<Stmt> finalbody)
        implements Stmt {

    public Try {
        body = List.copyOf(body);
        handlers = List.copyOf(handlers);
        orelse = List.copyOf(orelse);
        finalbody = List.copyOf(finalbody);
    }
}
