package com.trading.sdg.events;

/** Kinds of {@link OrchestratorEvent}, used for filtering subscriptions. */
public enum EventType {
    PIPELINE_STARTED,
    PIPELINE_COMPLETED,
    PIPELINE_FAILED,
    PIPELINE_CANCELLED,
    NODE_STARTED,
    NODE_COMPLETED,
    NODE_FAILED,
    NODE_SKIPPED,
    PROGRESS_SUMMARY
}
