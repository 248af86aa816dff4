package org.netpreserve.crawlguard.util;

import java.time.Duration;

/**
 * Ticker whose time only moves when a test advances it or something sleeps on it.
 */
public class FakeTicker implements Ticker {
    private long nanos = 1_000_000_000L;
    private long totalSlept;
    private int sleeps;

    @Override
    public synchronized long nanos() {
        return nanos;
    }

    @Override
    public synchronized void sleep(long nanos) {
        this.nanos += nanos;
        totalSlept += nanos;
        sleeps++;
    }

    public synchronized void advance(Duration duration) {
        nanos += duration.toNanos();
    }

    public synchronized Duration totalSlept() {
        return Duration.ofNanos(totalSlept);
    }

    public synchronized int sleeps() {
        return sleeps;
    }
}
