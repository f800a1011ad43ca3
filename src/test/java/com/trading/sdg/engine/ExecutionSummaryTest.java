package com.trading.sdg.engine;

import static org.junit.Assert.*;

import java.util.List;

import org.junit.Test;

public class ExecutionSummaryTest {

    private static final List<NodeOutcome> OUTCOMES = List.of(
            NodeOutcome.succeeded("src", "A"),
            NodeOutcome.succeeded("src", "B"),
            NodeOutcome.succeeded("avg", "A"),
            NodeOutcome.failed("avg", "B", RuntimeErrorKind.NODE_EXECUTION_FAILURE, "boom"),
            NodeOutcome.failed("avg", "C", RuntimeErrorKind.NODE_EXECUTION_FAILURE, "second"),
            NodeOutcome.skipped("sig", "B", RuntimeErrorKind.UPSTREAM_FAILURE, "upstream"));

    @Test
    public void testNodeCounts() {
        ExecutionSummary s = new ExecutionSummary(List.of("src", "avg", "sig", "idle"), OUTCOMES);
        assertEquals(1, s.nodesSucceeded());
        assertEquals(1, s.nodesFailed());
        // sig only skipped, idle never scheduled
        assertEquals(2, s.nodesSkipped());
    }

    @Test
    public void testRunCounts() {
        ExecutionSummary s = new ExecutionSummary(List.of("src", "avg", "sig"), OUTCOMES);
        assertEquals(3, s.count(NodeOutcome.Status.SUCCEEDED));
        assertEquals(2, s.count(NodeOutcome.Status.FAILED));
        assertEquals(1, s.count(NodeOutcome.Status.SKIPPED));
        assertEquals(2, s.failures().size());
    }

    @Test
    public void testPerAssetAndPerNode() {
        ExecutionSummary s = new ExecutionSummary(List.of("src", "avg", "sig"), OUTCOMES);
        assertEquals(new ExecutionSummary.Counts(1, 1, 1), s.forAsset("B"));
        assertEquals(new ExecutionSummary.Counts(1, 2, 0), s.forNode("avg"));
        assertEquals(0, s.forAsset("Z").total());
        assertEquals("boom", s.firstError("avg").orElseThrow());
        assertFalse(s.firstError("src").isPresent());
    }
}
