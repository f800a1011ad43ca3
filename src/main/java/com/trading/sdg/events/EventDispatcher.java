package com.trading.sdg.events;

import java.util.Arrays;
import java.util.function.Consumer;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.trading.sdg.util.ErrorRateLimiter;

/**
 * Synchronous fan-out of events to filtered subscribers.
 * <p>
 * Subscribers live in a copy-on-write array, so {@link #emit} iterates
 * without locking or allocating and may be called from any thread. A listener
 * that throws does not affect other listeners or the emitting worker; the
 * failure is logged, throttled.
 */
public class EventDispatcher implements EventSink {
    private static final Logger log = LogManager.getLogger(EventDispatcher.class);

    private final ErrorRateLimiter errorLimiter;
    private volatile Subscription[] subscriptions = new Subscription[0];

    public EventDispatcher() {
        this(1000);
    }

    public EventDispatcher(long errorLogIntervalMillis) {
        this.errorLimiter = new ErrorRateLimiter(log, errorLogIntervalMillis);
    }

    /** Handle returned by {@link #subscribe}; call {@link #close()} to stop receiving events. */
    public final class Subscription implements AutoCloseable {
        private final EventListener listener;
        private final EventFilter filter;

        private Subscription(EventListener listener, EventFilter filter) {
            this.listener = listener;
            this.filter = filter;
        }

        public EventFilter filter() {
            return filter;
        }

        @Override
        public void close() {
            remove(this);
        }
    }

    public Subscription subscribe(EventListener listener) {
        return subscribe(listener, EventFilter.all());
    }

    public synchronized Subscription subscribe(EventListener listener, EventFilter filter) {
        Subscription s = new Subscription(listener, filter);
        Subscription[] old = subscriptions;
        Subscription[] next = Arrays.copyOf(old, old.length + 1);
        next[old.length] = s;
        subscriptions = next;
        return s;
    }

    /** Subscribes to a single event record type. */
    public <E extends OrchestratorEvent> Subscription subscribeTo(Class<E> eventClass, Consumer<E> handler) {
        return subscribe(event -> {
            if (eventClass.isInstance(event))
                handler.accept(eventClass.cast(event));
        });
    }

    private synchronized void remove(Subscription s) {
        Subscription[] old = subscriptions;
        for (int i = 0; i < old.length; i++) {
            if (old[i] == s) {
                Subscription[] next = new Subscription[old.length - 1];
                System.arraycopy(old, 0, next, 0, i);
                System.arraycopy(old, i + 1, next, i, old.length - i - 1);
                subscriptions = next;
                return;
            }
        }
    }

    public int subscriberCount() {
        return subscriptions.length;
    }

    @Override
    public void emit(OrchestratorEvent event) {
        for (Subscription s : subscriptions) {
            if (!s.filter.accepts(event))
                continue;
            try {
                s.listener.onEvent(event);
            } catch (RuntimeException e) {
                errorLimiter.log("Event listener failed on " + event.type(), e);
            }
        }
    }
}
