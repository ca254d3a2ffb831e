package com.nodeflow.vgc.ast;

import java.util.List;

/**
 * {@code from module import names}.
 *
 * @param module Dotted module name, may be empty for a purely relative import.
 * @param level  Number of leading dots.
 */
public record ImportFrom(String module, List<Alias> names, int level) implements Stmt {

    public ImportFrom {
        module = module != null ? module : "";
        names = List.copyOf(names);
    }
}
