package com.nodeflow.vgc.codegen;

import java.util.ArrayList;
import java.util.List;

import com.nodeflow.vgc.ast.Assign;
import com.nodeflow.vgc.ast.Call;
import com.nodeflow.vgc.ast.ClassDef;
import com.nodeflow.vgc.ast.Comment;
import com.nodeflow.vgc.ast.Constant;
import com.nodeflow.vgc.ast.ExprStmt;
import com.nodeflow.vgc.ast.FunctionDef;
import com.nodeflow.vgc.ast.Module;
import com.nodeflow.vgc.ast.Name;
import com.nodeflow.vgc.ast.Stmt;

/**
 * Line-per-statement renderer used when {@link PythonUnparser} rejects a tree.
 * Handles the statement shapes lowering produces at top level; anything else
 * becomes a {@code # Kind} comment line.
 */
public final class FallbackRenderer {

    public String render(Module module) {
        List<String> lines = new ArrayList<>();
        for (Stmt s : module.body())
            render(s, lines);
        if (lines.isEmpty())
            return "# Empty module";
        return String.join("\n", lines);
    }

    private static void render(Stmt s, List<String> lines) {
        if (s instanceof Assign a && a.singleName() != null) {
            if (a.value() instanceof Constant c)
                lines.add(a.singleName() + " = " + PythonLiterals.repr(c.value()));
            else
                lines.add(a.singleName() + " = ...  # complex expression");
        } else if (s instanceof ExprStmt e && e.value() instanceof Call c && c.func() instanceof Name n) {
            lines.add(n.id() + "()");
        } else if (s instanceof FunctionDef f && !f.isAsync()) {
            lines.add("def " + f.name() + "():");
            lines.add("    pass");
        } else if (s instanceof ClassDef c) {
            lines.add("class " + c.name() + ":");
            lines.add("    pass");
        } else if (s instanceof Comment c) {
            for (String line : c.text().split("\n", -1))
                lines.add("# " + line);
        } else {
            lines.add("# " + (s == null ? "null" : s.kind()));
        }
    }
}
