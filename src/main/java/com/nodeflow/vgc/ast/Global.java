package com.nodeflow.vgc.ast;

import java.util.List;

/** {@code global} or, when {@code nonlocal} is set, {@code nonlocal}. */
public record Global(List<String> names, boolean nonlocal) implements Stmt {

    public Global {
        names = List.copyOf(names);
    }

    @Override
    public String kind() {
        return nonlocal ? "Nonlocal" : "Global";
    }
}
