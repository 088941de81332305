package io.datahub.client;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Consecutive auth-failure retries of one client. Only a fully successful call resets it.
 */
final class RetryCounter {

    private final int max;
    private final AtomicInteger count = new AtomicInteger();

    RetryCounter(int max) {
        if (max < 0) {
            throw new IllegalArgumentException("max must not be negative");
        }
        this.max = max;
    }

    /**
     * Counts one more retry and reports whether it is still within the bound.
     */
    boolean tryIncrement() {
        return count.incrementAndGet() <= max;
    }

    int count() {
        return count.get();
    }

    void reset() {
        count.set(0);
    }
}
