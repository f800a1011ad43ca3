package com.trading.sdg.util;

import java.util.concurrent.atomic.AtomicLong;

import org.apache.logging.log4j.Logger;

/**
 * Limits how often repeated failures are logged. Used where one bad node can
 * fail for hundreds of assets, or a listener can throw on every event.
 */
public class ErrorRateLimiter {
    private final Logger logger;
    private final long minIntervalNanos;
    private final AtomicLong lastLogTime = new AtomicLong(0);
    private final AtomicLong suppressed = new AtomicLong();

    public ErrorRateLimiter(Logger logger, long minIntervalMillis) {
        this.logger = logger;
        this.minIntervalNanos = minIntervalMillis * 1_000_000;
    }

    /** Logs at WARN, at most once per interval across all threads. */
    public void warn(String message, Throwable t) {
        if (tryAcquire())
            logger.warn(message + suffix(), t);
    }

    /** Logs at ERROR, at most once per interval across all threads. */
    public void log(String message, Throwable t) {
        if (tryAcquire())
            logger.error(message + suffix(), t);
    }

    /** Number of messages dropped since the last one that got through. */
    public long suppressedCount() {
        return suppressed.get();
    }

    private boolean tryAcquire() {
        long now = System.nanoTime();
        long last = lastLogTime.get();
        // First call always logs
        if ((last == 0 || now - last > minIntervalNanos) && lastLogTime.compareAndSet(last, now))
            return true;
        suppressed.incrementAndGet();
        return false;
    }

    private String suffix() {
        long n = suppressed.getAndSet(0);
        return n == 0 ? "" : " (Throttled, " + n + " similar suppressed)";
    }
}
