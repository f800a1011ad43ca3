package com.trading.sdg.events;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.lmax.disruptor.BlockingWaitStrategy;
import com.lmax.disruptor.RingBuffer;
import com.lmax.disruptor.dsl.Disruptor;
import com.lmax.disruptor.dsl.ProducerType;
import com.lmax.disruptor.util.DaemonThreadFactory;
import com.trading.sdg.util.ErrorRateLimiter;

/**
 * Asynchronous event channel: worker threads publish into an LMAX Disruptor
 * ring buffer and a single consumer thread forwards events, in publication
 * order, to the downstream sink.
 * <p>
 * Keeps slow listeners off the execution path. {@link #close()} drains the
 * buffer before returning.
 */
public final class DisruptorEventSink implements EventSink, AutoCloseable {
    private static final Logger log = LogManager.getLogger(DisruptorEventSink.class);

    private final Disruptor<EventSlot> disruptor;
    private final RingBuffer<EventSlot> ringBuffer;
    private final ErrorRateLimiter errorLimiter;
    private volatile boolean closed;

    /**
     * @param downstream receives events on the consumer thread.
     * @param bufferSize ring size, must be a power of two.
     */
    public DisruptorEventSink(EventSink downstream, int bufferSize) {
        if (Integer.bitCount(bufferSize) != 1)
            throw new IllegalArgumentException("Event buffer size must be a power of two: " + bufferSize);
        this.errorLimiter = new ErrorRateLimiter(log, 1000);
        this.disruptor = new Disruptor<>(
                EventSlot::new,
                bufferSize,
                DaemonThreadFactory.INSTANCE,
                ProducerType.MULTI,
                new BlockingWaitStrategy());
        disruptor.handleEventsWith((slot, sequence, endOfBatch) -> {
            try {
                downstream.emit(slot.event());
            } catch (RuntimeException e) {
                errorLimiter.log("Event delivery failed for sequence " + sequence, e);
            } finally {
                slot.clear();
            }
        });
        this.ringBuffer = disruptor.start();
    }

    @Override
    public void emit(OrchestratorEvent event) {
        if (closed) {
            log.debug("Dropping {} after close", event.type());
            return;
        }
        long seq = ringBuffer.next();
        try {
            ringBuffer.get(seq).set(event, seq);
        } finally {
            ringBuffer.publish(seq);
        }
    }

    public long remainingCapacity() {
        return ringBuffer.remainingCapacity();
    }

    /** Waits until every published event has been delivered, then stops the consumer. */
    @Override
    public void close() {
        if (closed)
            return;
        closed = true;
        disruptor.shutdown();
    }
}
