package com.nodeflow.vgc.codegen;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import com.nodeflow.vgc.api.NodeKind;
import com.nodeflow.vgc.api.VisualNode;
import com.nodeflow.vgc.engine.VisualGraph;

/**
 * Appends the first comment of a variable node to the line assigning that
 * variable. The assigned name is the text before the first {@code =}.
 */
public final class InlineCommentPass {

    public String apply(String code, VisualGraph graph) {
        String[] lines = code.split("\n", -1);
        List<String> out = new ArrayList<>(lines.length);
        for (String line : lines) {
            int eq = line.indexOf('=');
            if (eq < 0 || line.strip().startsWith("#")) {
                out.add(line);
                continue;
            }
            Optional<String> comment = commentFor(line.substring(0, eq).strip(), graph);
            out.add(comment.isPresent() ? line + "  # " + comment.get() : line);
        }
        return String.join("\n", out);
    }

    private static Optional<String> commentFor(String variable, VisualGraph graph) {
        for (VisualNode n : graph.nodes()) {
            if (n.getKind() == NodeKind.VARIABLE && variable.equals(n.parameter("variable_name"))
                    && !n.getComments().isEmpty())
                return Optional.of(n.getComments().get(0));
        }
        return Optional.empty();
    }
}
