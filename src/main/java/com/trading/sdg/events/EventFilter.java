package com.trading.sdg.events;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/** Selects which event types a subscriber receives. Immutable. */
public final class EventFilter {

    private static final EventFilter ALL = new EventFilter(EnumSet.allOf(EventType.class));
    private static final EventFilter NONE = new EventFilter(EnumSet.noneOf(EventType.class));

    private final Set<EventType> accepted;

    private EventFilter(EnumSet<EventType> accepted) {
        this.accepted = Collections.unmodifiableSet(accepted);
    }

    public static EventFilter all() {
        return ALL;
    }

    public static EventFilter none() {
        return NONE;
    }

    public static EventFilter only(EventType first, EventType... rest) {
        return new EventFilter(EnumSet.of(first, rest));
    }

    public static EventFilter except(EventType first, EventType... rest) {
        return new EventFilter(EnumSet.complementOf(EnumSet.of(first, rest)));
    }

    public static EventFilter pipelineOnly() {
        return only(EventType.PIPELINE_STARTED, EventType.PIPELINE_COMPLETED, EventType.PIPELINE_FAILED,
                EventType.PIPELINE_CANCELLED);
    }

    public static EventFilter nodesOnly() {
        return only(EventType.NODE_STARTED, EventType.NODE_COMPLETED, EventType.NODE_FAILED, EventType.NODE_SKIPPED);
    }

    public static EventFilter progressOnly() {
        return only(EventType.PROGRESS_SUMMARY);
    }

    public boolean accepts(EventType type) {
        return accepted.contains(type);
    }

    public boolean accepts(OrchestratorEvent event) {
        return accepts(event.type());
    }

    /** Accepts what either filter accepts. */
    public EventFilter or(EventFilter other) {
        EnumSet<EventType> union = copy();
        union.addAll(other.accepted);
        return new EventFilter(union);
    }

    /** Accepts what both filters accept. */
    public EventFilter and(EventFilter other) {
        EnumSet<EventType> both = copy();
        both.retainAll(other.accepted);
        return new EventFilter(both);
    }

    private EnumSet<EventType> copy() {
        return accepted.isEmpty() ? EnumSet.noneOf(EventType.class) : EnumSet.copyOf(accepted);
    }

    @Override
    public String toString() {
        return "EventFilter" + accepted;
    }
}
