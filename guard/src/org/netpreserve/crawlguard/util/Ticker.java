package org.netpreserve.crawlguard.util;

import java.util.concurrent.TimeUnit;

/**
 * Monotonic time source used for pacing. Readings are only meaningful relative to each other.
 */
public interface Ticker {
    Ticker SYSTEM = new Ticker() {
        @Override
        public long nanos() {
            return System.nanoTime();
        }

        @Override
        public void sleep(long nanos) throws InterruptedException {
            TimeUnit.NANOSECONDS.sleep(nanos);
        }
    };

    long nanos();

    void sleep(long nanos) throws InterruptedException;
}
