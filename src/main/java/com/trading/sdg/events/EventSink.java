package com.trading.sdg.events;

/**
 * Destination of orchestrator events. Implementations must accept concurrent
 * calls from worker threads.
 */
@FunctionalInterface
public interface EventSink {

    /** Discards every event. */
    EventSink NOOP = event -> {
    };

    void emit(OrchestratorEvent event);
}
