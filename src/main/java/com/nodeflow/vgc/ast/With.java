package com.nodeflow.vgc.ast;

import java.util.List;

public record With(List<WithItem> items, List<Stmt> body, boolean isAsync) implements Stmt {

    public With {
        items = List.copyOf(items);
        body = List.copyOf(body);
    }

    @Override
    public String kind() {
        return isAsync ? "AsyncWith" : "With";
    }
}
