package com.nodeflow.vgc.codegen;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;

import com.nodeflow.vgc.ast.Arg;
import com.nodeflow.vgc.ast.AstTransformer;
import com.nodeflow.vgc.ast.AstWalker;
import com.nodeflow.vgc.ast.ClassDef;
import com.nodeflow.vgc.ast.Constant;
import com.nodeflow.vgc.ast.Expr;
import com.nodeflow.vgc.ast.ExprStmt;
import com.nodeflow.vgc.ast.FunctionDef;
import com.nodeflow.vgc.ast.Raise;
import com.nodeflow.vgc.ast.Stmt;

/**
 * Inserts a generated docstring into every function and class that lacks one.
 *
 * <p>
 * The inserted statements are remembered by identity so that
 * {@link CommentPreservationPass} can tell a synthesized docstring from one the
 * author wrote.
 */
public final class DocstringPass extends AstTransformer {
    private static final int MAX_LISTED_METHODS = 3;

    private final PythonUnparser unparser = new PythonUnparser();
    private final Set<Stmt> synthesized = Collections.newSetFromMap(new IdentityHashMap<>());

    /** Docstring statements inserted by this pass so far. */
    public Set<Stmt> synthesized() {
        return Collections.unmodifiableSet(synthesized);
    }

    @Override
    protected Stmt visitFunctionDef(FunctionDef function) {
        if (hasDocstring(function.body()))
            return function;
        return function.withBody(prepend(docstring(functionDocstring(function)), function.body()));
    }

    @Override
    protected Stmt visitClassDef(ClassDef cls) {
        if (hasDocstring(cls.body()))
            return cls;
        return cls.withBody(prepend(docstring(classDocstring(cls)), cls.body()));
    }

    private Stmt docstring(String text) {
        Stmt s = new ExprStmt(new Constant(text));
        synthesized.add(s);
        return s;
    }

    String functionDocstring(FunctionDef f) {
        List<String> lines = new ArrayList<>();
        String name = f.name();
        if (name.length() > 4 && name.startsWith("__") && name.endsWith("__"))
            lines.add("Special method " + name + ".");
        else if (name.startsWith("_"))
            lines.add("Private function " + name + ".");
        else
            lines.add("Function " + name + ".");

        List<String> params = new ArrayList<>();
        for (Arg a : f.args().args())
            params.add(describe(a));
        if (f.args().vararg() != null)
            params.add("*" + f.args().vararg().name() + ": Variable length argument list.");
        for (Arg a : f.args().kwonlyargs())
            params.add(describe(a));
        if (f.args().kwarg() != null)
            params.add("**" + f.args().kwarg().name() + ": Arbitrary keyword arguments.");
        section(lines, "Args:", params);

        if (f.returns() != null)
            section(lines, "Returns:", List.of(typeName(f.returns()) + ": Description of return value."));
        else
            section(lines, "Returns:", List.of("None: This function doesn't return a value."));

        if (AstWalker.anyMatch(f, n -> n instanceof Raise))
            section(lines, "Raises:", List.of("Exception: Description of when this exception is raised."));
        return String.join("\n", lines);
    }

    String classDocstring(ClassDef c) {
        List<String> lines = new ArrayList<>();
        lines.add("Class " + c.name() + ".");
        if (!c.bases().isEmpty()) {
            List<String> bases = new ArrayList<>();
            for (Expr b : c.bases())
                bases.add(typeName(b));
            lines.add("");
            lines.add("Inherits from: " + String.join(", ", bases));
        }
        section(lines, "Attributes:", List.of("Attributes will be documented here."));

        List<String> methods = new ArrayList<>();
        for (Stmt s : c.body()) {
            if (s instanceof FunctionDef m && methods.size() < MAX_LISTED_METHODS)
                methods.add(m.name() + "(): " + title(m.name()) + " method.");
        }
        section(lines, "Methods:", methods);
        return String.join("\n", lines);
    }

    private String describe(Arg a) {
        String type = a.annotation() != null ? typeName(a.annotation()) : TypeHintPass.ANY;
        return a.name() + " (" + type + "): Description of " + a.name() + ".";
    }

    private String typeName(Expr annotation) {
        try {
            return unparser.expression(annotation);
        } catch (IllegalStateException e) {
            return TypeHintPass.ANY;
        }
    }

    private static void section(List<String> lines, String heading, List<String> entries) {
        if (entries.isEmpty())
            return;
        lines.add("");
        lines.add(heading);
        for (String e : entries)
            lines.add("    " + e);
    }

    /** {@code __get_item__} becomes {@code Get Item}. */
    private static String title(String name) {
        StringBuilder sb = new StringBuilder();
        for (String word : name.split("_")) {
            if (word.isEmpty())
                continue;
            if (sb.length() > 0)
                sb.append(' ');
            sb.append(Character.toUpperCase(word.charAt(0))).append(word.substring(1).toLowerCase());
        }
        return sb.toString();
    }
}
