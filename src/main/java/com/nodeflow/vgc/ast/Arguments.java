package com.nodeflow.vgc.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * Parameter list of a function: positional parameters, {@code *vararg},
 * keyword-only parameters, {@code **kwarg}. Either star parameter may be null.
 */
public record Arguments(List<Arg> args, Arg vararg, List<Arg> kwonlyargs, Arg kwarg) implements AstNode {
    public static final Arguments EMPTY = new Arguments(List.of(), null, List.of(), null);

    public Arguments {
        args = List.copyOf(args);
        kwonlyargs = List.copyOf(kwonlyargs);
    }

    /** Positional parameters without annotations or defaults. */
    public static Arguments of(String... names) {
        List<Arg> list = new ArrayList<>(names.length);
        for (String n : names)
            list.add(Arg.of(n));
        return new Arguments(list, null, List.of(), null);
    }

    public boolean isEmpty() {
        return args.isEmpty() && vararg == null && kwonlyargs.isEmpty() && kwarg == null;
    }
}
