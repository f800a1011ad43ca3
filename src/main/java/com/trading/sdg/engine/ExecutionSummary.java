package com.trading.sdg.engine;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Per-node, per-asset outcome counts of one pipeline run. Immutable.
 */
public final class ExecutionSummary {

    /** Outcome counts of one asset or one node. */
    public record Counts(int succeeded, int failed, int skipped) {
        Counts add(NodeOutcome.Status s) {
            return switch (s) {
                case SUCCEEDED -> new Counts(succeeded + 1, failed, skipped);
                case FAILED -> new Counts(succeeded, failed + 1, skipped);
                case SKIPPED -> new Counts(succeeded, failed, skipped + 1);
            };
        }

        public int total() {
            return succeeded + failed + skipped;
        }
    }

    private static final Counts ZERO = new Counts(0, 0, 0);

    private final List<NodeOutcome> outcomes;
    private final Map<String, Counts> byAsset = new LinkedHashMap<>();
    private final Map<String, Counts> byNode = new LinkedHashMap<>();
    private final Map<String, String> firstErrorByNode = new LinkedHashMap<>();

    public ExecutionSummary(List<String> nodeIds, List<NodeOutcome> outcomes) {
        this.outcomes = List.copyOf(outcomes);
        for (String id : nodeIds)
            byNode.put(id, ZERO);
        for (NodeOutcome o : outcomes) {
            byAsset.merge(o.asset(), ZERO.add(o.status()), (a, b) -> a.add(o.status()));
            byNode.put(o.nodeId(), byNode.getOrDefault(o.nodeId(), ZERO).add(o.status()));
            if (o.status() == NodeOutcome.Status.FAILED)
                firstErrorByNode.putIfAbsent(o.nodeId(), o.message());
        }
    }

    public List<NodeOutcome> outcomes() {
        return outcomes;
    }

    /** Number of (node, asset) executions with the given status. */
    public int count(NodeOutcome.Status status) {
        int n = 0;
        for (NodeOutcome o : outcomes) {
            if (o.status() == status)
                n++;
        }
        return n;
    }

    /** Nodes that produced output for at least one asset and failed for none. */
    public int nodesSucceeded() {
        int n = 0;
        for (Counts c : byNode.values()) {
            if (c.failed() == 0 && c.succeeded() > 0)
                n++;
        }
        return n;
    }

    /** Nodes that failed for at least one asset. */
    public int nodesFailed() {
        int n = 0;
        for (Counts c : byNode.values()) {
            if (c.failed() > 0)
                n++;
        }
        return n;
    }

    /** Nodes that never ran. */
    public int nodesSkipped() {
        int n = 0;
        for (Counts c : byNode.values()) {
            if (c.failed() == 0 && c.succeeded() == 0)
                n++;
        }
        return n;
    }

    public Counts forAsset(String asset) {
        return byAsset.getOrDefault(asset, ZERO);
    }

    public Counts forNode(String nodeId) {
        return byNode.getOrDefault(nodeId, ZERO);
    }

    public Map<String, Counts> countsByAsset() {
        return Collections.unmodifiableMap(byAsset);
    }

    public Optional<String> firstError(String nodeId) {
        return Optional.ofNullable(firstErrorByNode.get(nodeId));
    }

    public List<NodeOutcome> failures() {
        List<NodeOutcome> out = new ArrayList<>();
        for (NodeOutcome o : outcomes) {
            if (o.status() == NodeOutcome.Status.FAILED)
                out.add(o);
        }
        return out;
    }

    @Override
    public String toString() {
        return "ExecutionSummary[nodes: " + nodesSucceeded() + " succeeded, " + nodesFailed() + " failed, "
                + nodesSkipped() + " skipped; runs: " + count(NodeOutcome.Status.SUCCEEDED) + "/"
                + outcomes.size() + " ok]";
    }
}
