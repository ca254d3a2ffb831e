package com.nodeflow.vgc.engine;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Depth-first cycle search with an explicit recursion stack.
 *
 * <p>
 * Roots are visited in graph insertion order. The first edge that points back
 * into the active stack closes a cycle; the path from that node around to
 * itself is returned.
 */
final class CycleDetector {
    private static final int UNVISITED = 0, ON_STACK = 1, DONE = 2;

    private CycleDetector() {
    }

    static Optional<List<UUID>> findCycle(DependencyView view) {
        int n = view.nodeCount();
        int[] state = new int[n];
        int[] pathNode = new int[n];
        int[] nextChild = new int[n];

        for (int root = 0; root < n; root++) {
            if (state[root] != UNVISITED)
                continue;
            int depth = 0;
            pathNode[depth] = root;
            nextChild[depth] = 0;
            state[root] = ON_STACK;

            while (depth >= 0) {
                int curr = pathNode[depth];
                int[] children = view.successors(curr);
                if (nextChild[depth] < children.length) {
                    int child = children[nextChild[depth]++];
                    if (state[child] == ON_STACK)
                        return Optional.of(cyclePath(view, pathNode, depth, child));
                    if (state[child] == UNVISITED) {
                        state[child] = ON_STACK;
                        depth++;
                        pathNode[depth] = child;
                        nextChild[depth] = 0;
                    }
                } else {
                    state[curr] = DONE;
                    depth--;
                }
            }
        }
        return Optional.empty();
    }

    private static List<UUID> cyclePath(DependencyView view, int[] pathNode, int depth, int backEdgeTarget) {
        List<UUID> path = new ArrayList<>();
        int start = depth;
        while (pathNode[start] != backEdgeTarget)
            start--;
        for (int i = start; i <= depth; i++)
            path.add(view.id(pathNode[i]));
        path.add(view.id(backEdgeTarget));
        return Collections.unmodifiableList(path);
    }
}
