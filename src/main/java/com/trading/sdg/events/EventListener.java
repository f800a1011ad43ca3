package com.trading.sdg.events;

/** Receives orchestrator events. May be called from several threads at once. */
@FunctionalInterface
public interface EventListener {
    void onEvent(OrchestratorEvent event);
}
