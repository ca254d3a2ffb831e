package com.nodeflow.vgc.engine;

import com.nodeflow.vgc.api.Connection;
import org.junit.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.junit.Assert.*;

public class TopologicalOrderTest {

    private static List<UUID> ids(int n) {
        List<UUID> ids = new ArrayList<>();
        for (int i = 0; i < n; i++)
            ids.add(UUID.randomUUID());
        return ids;
    }

    private static Connection edge(UUID from, UUID to) {
        return Connection.between(from, "out", to, "in");
    }

    @Test
    public void testDiamondFollowsConnectionOrder() {
        List<UUID> n = ids(4);
        UUID d = n.get(0), c = n.get(1), b = n.get(2), a = n.get(3);
        DependencyView view = DependencyView.of(n, List.of(edge(a, c), edge(a, b), edge(c, d), edge(b, d)));

        TopologicalOrder order = TopologicalOrder.compute(view);

        assertTrue(order.isComplete());
        assertEquals(List.of(a, c, b, d), order.toList());
    }

    @Test
    public void testCycleStopsOrderingEarly() {
        List<UUID> n = ids(4);
        UUID a = n.get(0), b = n.get(1), c = n.get(2), d = n.get(3);
        DependencyView view = DependencyView.of(n, List.of(edge(a, b), edge(b, c), edge(c, b)));

        TopologicalOrder order = TopologicalOrder.compute(view);

        assertFalse(order.isComplete());
        assertEquals(2, order.processedCount()); // a and d only
        assertEquals(4, order.nodeCount());
        assertTrue(order.toList().isEmpty());

        Optional<List<UUID>> cycle = CycleDetector.findCycle(view);
        assertTrue(cycle.isPresent());
        assertEquals(List.of(b, c, b), cycle.get());
    }

    @Test
    public void testUnknownEndpointsIgnored() {
        List<UUID> n = ids(2);
        DependencyView view = DependencyView.of(n, List.of(edge(n.get(1), UUID.randomUUID()), edge(n.get(1), n.get(0))));

        assertEquals(List.of(n.get(1), n.get(0)), TopologicalOrder.compute(view).toList());
        assertFalse(CycleDetector.findCycle(view).isPresent());
    }

    @Test
    public void testEmptyGraph() {
        TopologicalOrder order = TopologicalOrder.compute(DependencyView.of(List.of(), List.of()));
        assertTrue(order.isComplete());
        assertTrue(order.toList().isEmpty());
    }
}
