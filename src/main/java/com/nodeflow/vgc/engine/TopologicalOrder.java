package com.nodeflow.vgc.engine;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;

/**
 * Execution order of a visual graph, computed with Kahn's algorithm.
 *
 * <p>
 * Zero in-degree nodes are seeded in graph insertion order; a node becomes
 * ready when its last incoming connection is consumed, in connection order.
 * The result is deterministic for a given graph.
 *
 * <p>
 * A graph with a cycle cannot be fully ordered. Such an order is
 * {@link #isComplete() incomplete} and {@link #toList()} returns an empty
 * list rather than the partial prefix.
 */
public final class TopologicalOrder {
    private final List<UUID> order;
    private final int nodeCount;

    private TopologicalOrder(List<UUID> order, int nodeCount) {
        this.order = order;
        this.nodeCount = nodeCount;
    }

    static TopologicalOrder compute(DependencyView view) {
        int n = view.nodeCount();
        int[] inDegree = new int[n];

        // 1. Calculate in-degrees
        for (int i = 0; i < n; i++)
            for (int child : view.successors(i))
                inDegree[child]++;

        // 2. Seed with in-degree 0, insertion order
        int[] queue = new int[n];
        int head = 0, tail = 0;
        for (int i = 0; i < n; i++)
            if (inDegree[i] == 0)
                queue[tail++] = i;

        // 3. Process queue
        List<UUID> result = new ArrayList<>(n);
        while (head < tail) {
            int curr = queue[head++];
            result.add(view.id(curr));
            for (int child : view.successors(curr))
                if (--inDegree[child] == 0)
                    queue[tail++] = child;
        }
        return new TopologicalOrder(Collections.unmodifiableList(result), n);
    }

    /** True when every node was ordered, i.e. the graph is acyclic. */
    public boolean isComplete() {
        return order.size() == nodeCount;
    }

    /** Number of nodes emitted before the queue ran dry. */
    public int processedCount() {
        return order.size();
    }

    public int nodeCount() {
        return nodeCount;
    }

    /** The full order, or an empty list when the graph is unorderable. */
    public List<UUID> toList() {
        return isComplete() ? order : List.of();
    }
}
