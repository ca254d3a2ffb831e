package com.nodeflow.vgc.codegen;

import java.util.Optional;

import com.nodeflow.vgc.api.VisualNode;
import com.nodeflow.vgc.engine.VisualGraph;

/**
 * Finds the graph node a generated definition came from: the first node, in
 * insertion order, whose {@code function_name} (or {@code class_name})
 * parameter equals the definition's name.
 */
final class DefinitionMatcher {
    private final VisualGraph graph;

    DefinitionMatcher(VisualGraph graph) {
        this.graph = graph;
    }

    Optional<VisualNode> forFunction(String name) {
        return find("function_name", name);
    }

    Optional<VisualNode> forClass(String name) {
        return find("class_name", name);
    }

    private Optional<VisualNode> find(String key, String name) {
        for (VisualNode n : graph.nodes())
            if (name.equals(n.parameter(key)))
                return Optional.of(n);
        return Optional.empty();
    }
}
