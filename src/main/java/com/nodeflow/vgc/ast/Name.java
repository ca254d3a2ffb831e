package com.nodeflow.vgc.ast;

import java.util.Objects;

public record Name(String id) implements Expr {

    public Name {
        Objects.requireNonNull(id, "id");
    }
}
