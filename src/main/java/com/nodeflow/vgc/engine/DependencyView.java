package com.nodeflow.vgc.engine;

import com.nodeflow.vgc.api.Connection;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Index-based adjacency snapshot of a graph's node-dependency relation.
 *
 * <p>
 * Nodes are numbered in graph insertion order; successor lists keep the order
 * of the connection list. Connections whose endpoints are unknown are left
 * out (validation reports them separately). Both the execution order and the
 * cycle check read from this view.
 */
final class DependencyView {
    private final UUID[] ids;
    private final Map<UUID, Integer> indexOf;
    private final int[][] successors;

    private DependencyView(UUID[] ids, Map<UUID, Integer> indexOf, int[][] successors) {
        this.ids = ids;
        this.indexOf = indexOf;
        this.successors = successors;
    }

    static DependencyView of(Collection<UUID> nodeIds, List<Connection> connections) {
        int n = nodeIds.size();
        UUID[] ids = nodeIds.toArray(new UUID[0]);
        Map<UUID, Integer> indexOf = new HashMap<>(n * 2);
        for (int i = 0; i < n; i++)
            indexOf.put(ids[i], i);

        List<List<Integer>> forward = new ArrayList<>(n);
        for (int i = 0; i < n; i++)
            forward.add(new ArrayList<>());
        for (Connection c : connections) {
            Integer from = indexOf.get(c.sourceNodeId());
            Integer to = indexOf.get(c.targetNodeId());
            if (from == null || to == null)
                continue;
            forward.get(from).add(to);
        }

        int[][] successors = new int[n][];
        for (int i = 0; i < n; i++) {
            List<Integer> children = forward.get(i);
            successors[i] = new int[children.size()];
            for (int j = 0; j < children.size(); j++)
                successors[i][j] = children.get(j);
        }
        return new DependencyView(ids, indexOf, successors);
    }

    int nodeCount() {
        return ids.length;
    }

    UUID id(int index) {
        return ids[index];
    }

    int index(UUID id) {
        Integer idx = indexOf.get(id);
        return idx != null ? idx : -1;
    }

    int[] successors(int index) {
        return successors[index];
    }

    /** True if {@code to} is reachable from {@code from} (inclusive). */
    boolean reaches(int from, int to) {
        if (from == to)
            return true;
        boolean[] seen = new boolean[ids.length];
        int[] stack = new int[ids.length];
        int top = 0;
        stack[top++] = from;
        seen[from] = true;
        while (top > 0) {
            int curr = stack[--top];
            for (int child : successors[curr]) {
                if (child == to)
                    return true;
                if (!seen[child]) {
                    seen[child] = true;
                    stack[top++] = child;
                }
            }
        }
        return false;
    }
}
