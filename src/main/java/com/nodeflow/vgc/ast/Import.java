package com.nodeflow.vgc.ast;

import java.util.List;

public record Import(List<Alias> names) implements Stmt {

    public Import {
        names = List.copyOf(names);
    }
}
