package com.trading.sdg.events;

import java.util.List;

/**
 * Lifecycle event emitted by the orchestrator. Events are immutable and may be
 * delivered from any worker thread.
 */
public interface OrchestratorEvent {

    EventType type();

    /** Wall-clock emission time, epoch millis. */
    long timestamp();

    // ── Pipeline ────────────────────────────────────────────────────

    record PipelineStarted(long timestamp, int totalNodes, int totalAssets, List<String> nodeIds)
            implements OrchestratorEvent {
        public PipelineStarted {
            nodeIds = List.copyOf(nodeIds);
        }

        @Override
        public EventType type() {
            return EventType.PIPELINE_STARTED;
        }
    }

    record PipelineCompleted(long timestamp, long durationMillis, int nodesSucceeded, int nodesFailed,
            int nodesSkipped) implements OrchestratorEvent {
        @Override
        public EventType type() {
            return EventType.PIPELINE_COMPLETED;
        }
    }

    record PipelineFailed(long timestamp, long elapsedMillis, String errorMessage) implements OrchestratorEvent {
        @Override
        public EventType type() {
            return EventType.PIPELINE_FAILED;
        }
    }

    record PipelineCancelled(long timestamp, long elapsedMillis, int nodesCompleted, int nodesTotal)
            implements OrchestratorEvent {
        @Override
        public EventType type() {
            return EventType.PIPELINE_CANCELLED;
        }
    }

    // ── Nodes ───────────────────────────────────────────────────────

    record NodeStarted(long timestamp, String nodeId, String transformName, boolean crossSectional, int nodeIndex,
            int totalNodes, int assetCount) implements OrchestratorEvent {
        @Override
        public EventType type() {
            return EventType.NODE_STARTED;
        }
    }

    record NodeCompleted(long timestamp, String nodeId, String transformName, long durationMillis,
            int assetsProcessed, int assetsFailed) implements OrchestratorEvent {
        @Override
        public EventType type() {
            return EventType.NODE_COMPLETED;
        }
    }

    /** @param assetId failing asset, null when the failure is not asset specific. */
    record NodeFailed(long timestamp, String nodeId, String transformName, String errorMessage, String assetId)
            implements OrchestratorEvent {
        @Override
        public EventType type() {
            return EventType.NODE_FAILED;
        }
    }

    record NodeSkipped(long timestamp, String nodeId, String transformName, String reason)
            implements OrchestratorEvent {
        @Override
        public EventType type() {
            return EventType.NODE_SKIPPED;
        }
    }

    // ── Progress ────────────────────────────────────────────────────

    record ProgressSummary(long timestamp, double overallProgressPercent, int nodesCompleted, int nodesTotal,
            List<String> currentlyRunning) implements OrchestratorEvent {
        public ProgressSummary {
            currentlyRunning = List.copyOf(currentlyRunning);
        }

        @Override
        public EventType type() {
            return EventType.PROGRESS_SUMMARY;
        }
    }
}
