package com.trading.sdg.events;

import static org.junit.Assert.*;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import org.junit.Test;

public class DisruptorEventSinkTest {

    private static OrchestratorEvent skipped(int i) {
        return new OrchestratorEvent.NodeSkipped(i, "n" + i, "sma", "reason");
    }

    @Test
    public void testDeliversInOrderAndDrainsOnClose() {
        List<String> got = Collections.synchronizedList(new ArrayList<>());
        DisruptorEventSink sink = new DisruptorEventSink(e -> got.add(((OrchestratorEvent.NodeSkipped) e).nodeId()), 8);
        for (int i = 0; i < 100; i++)
            sink.emit(skipped(i));
        sink.close();

        assertEquals(100, got.size());
        for (int i = 0; i < 100; i++)
            assertEquals("n" + i, got.get(i));
    }

    @Test
    public void testConcurrentProducers() throws InterruptedException {
        List<OrchestratorEvent> got = Collections.synchronizedList(new ArrayList<>());
        DisruptorEventSink sink = new DisruptorEventSink(got::add, 64);
        int threads = 4, perThread = 250;
        CountDownLatch done = new CountDownLatch(threads);
        for (int t = 0; t < threads; t++) {
            new Thread(() -> {
                for (int i = 0; i < perThread; i++)
                    sink.emit(skipped(i));
                done.countDown();
            }).start();
        }
        assertTrue(done.await(10, TimeUnit.SECONDS));
        sink.close();
        assertEquals(threads * perThread, got.size());
    }

    @Test
    public void testDownstreamFailureDoesNotStopDelivery() {
        List<OrchestratorEvent> got = new ArrayList<>();
        DisruptorEventSink sink = new DisruptorEventSink(e -> {
            if (e.timestamp() == 1)
                throw new IllegalStateException("listener bug");
            got.add(e);
        }, 4);
        sink.emit(skipped(0));
        sink.emit(skipped(1));
        sink.emit(skipped(2));
        sink.close();
        assertEquals(2, got.size());
    }

    @Test
    public void testEmitAfterCloseIsDropped() {
        List<OrchestratorEvent> got = new ArrayList<>();
        DisruptorEventSink sink = new DisruptorEventSink(got::add, 4);
        sink.close();
        sink.emit(skipped(0));
        assertTrue(got.isEmpty());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testBufferSizeMustBePowerOfTwo() {
        new DisruptorEventSink(EventSink.NOOP, 100);
    }
}
