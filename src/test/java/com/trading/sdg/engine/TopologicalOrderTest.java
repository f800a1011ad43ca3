package com.trading.sdg.engine;

import static org.junit.Assert.*;

import java.util.List;

import org.junit.Test;

public class TopologicalOrderTest {

    @Test
    public void testEmptyGraph() {
        TopologicalOrder order = TopologicalOrder.builder().build();
        assertTrue(order.ids().isEmpty());
    }

    @Test
    public void testSingleNode() {
        TopologicalOrder order = TopologicalOrder.builder()
                .addNode("src")
                .build();

        assertEquals(List.of("src"), order.ids());
        assertEquals(0, order.topoIndex("src"));
    }

    @Test
    public void testLinearGraph() {
        // c depends on b, b on a; added in reverse
        TopologicalOrder order = TopologicalOrder.builder()
                .addNode("c").addNode("b").addNode("a")
                .addEdge("a", "b")
                .addEdge("b", "c")
                .build();

        assertEquals(List.of("a", "b", "c"), order.ids());
        assertEquals(2, order.topoIndex("c"));
    }

    @Test
    public void testDiamondGraph() {
        TopologicalOrder order = TopologicalOrder.builder()
                .addNode("src").addNode("fast").addNode("slow").addNode("cross")
                .addEdge("src", "fast")
                .addEdge("src", "slow")
                .addEdge("fast", "cross")
                .addEdge("slow", "cross")
                .build();

        int fast = order.topoIndex("fast");
        int slow = order.topoIndex("slow");
        int cross = order.topoIndex("cross");
        assertEquals(0, order.topoIndex("src"));
        assertTrue(cross > fast);
        assertTrue(cross > slow);
        assertEquals(List.of("fast", "slow"), order.dependents("src"));
        assertEquals(List.of("cross"), order.dependents("fast"));
        assertTrue(order.dependents("cross").isEmpty());
    }

    @Test
    public void testTiesKeepInsertionOrder() {
        TopologicalOrder order = TopologicalOrder.builder()
                .addNode("x").addNode("y").addNode("z")
                .build();
        assertEquals(List.of("x", "y", "z"), order.ids());
    }

    @Test
    public void testRepeatedEdgeCollapses() {
        TopologicalOrder order = TopologicalOrder.builder()
                .addNode("b").addNode("a")
                .addEdge("a", "b")
                .addEdge("a", "b")
                .build();
        assertEquals(List.of("a", "b"), order.ids());
        assertEquals(List.of("b"), order.dependents("a"));
    }

    @Test
    public void testCycleDetection() {
        try {
            TopologicalOrder.builder()
                    .addNode("a").addNode("b").addNode("c").addNode("d")
                    .addEdge("a", "b")
                    .addEdge("b", "c")
                    .addEdge("c", "b")
                    .addEdge("c", "d")
                    .build();
            fail("Should have detected the cycle");
        } catch (TopologicalOrder.CycleDetectedException e) {
            assertTrue(e.remaining().contains("b"));
            assertTrue(e.remaining().contains("c"));
            assertFalse(e.remaining().contains("a"));
        }
    }

    @Test(expected = IllegalStateException.class)
    public void testSelfLoopDetection() {
        TopologicalOrder.builder()
                .addNode("a")
                .addEdge("a", "a")
                .build();
    }

    @Test(expected = IllegalArgumentException.class)
    public void testDuplicateNodeException() {
        TopologicalOrder.builder()
                .addNode("a")
                .addNode("a");
    }

    @Test(expected = IllegalArgumentException.class)
    public void testUnknownEdgeTargetException() {
        TopologicalOrder.builder()
                .addNode("a")
                .addEdge("a", "b");
    }

    @Test(expected = IllegalArgumentException.class)
    public void testInvalidTopoIndexLookup() {
        TopologicalOrder order = TopologicalOrder.builder().addNode("a").build();
        order.topoIndex("UNKNOWN");
    }
}
