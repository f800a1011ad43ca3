package com.trading.sdg.events;

/**
 * Pre-allocated ring buffer entry carrying one event reference.
 * Instances are reused for the lifetime of the ring buffer.
 */
public final class EventSlot {
    private OrchestratorEvent event;
    private long sequenceId;

    public void set(OrchestratorEvent event, long seqId) {
        this.event = event;
        this.sequenceId = seqId;
    }

    public OrchestratorEvent event() {
        return event;
    }

    public long sequenceId() {
        return sequenceId;
    }

    /** Drops the reference so delivered events can be collected. */
    public void clear() {
        event = null;
        sequenceId = 0;
    }
}
