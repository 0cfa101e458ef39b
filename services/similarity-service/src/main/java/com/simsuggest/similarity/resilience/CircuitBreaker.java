package com.simsuggest.similarity.resilience;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.LongSupplier;

/**
 * Opens after {@code failureThreshold} consecutive failures and rejects calls for {@code openDurationMs}.
 * After that the next call goes through and either resets or re-opens it.
 */
public class CircuitBreaker {
    private final int failureThreshold;
    private final long openDurationMs;
    private final LongSupplier clock;
    private final AtomicInteger failureCount = new AtomicInteger(0);
    private final AtomicLong openUntilMs = new AtomicLong(0L);

    public CircuitBreaker(int failureThreshold, long openDurationMs) {
        this(failureThreshold, openDurationMs, System::currentTimeMillis);
    }

    CircuitBreaker(int failureThreshold, long openDurationMs, LongSupplier clock) {
        this.failureThreshold = Math.max(1, failureThreshold);
        this.openDurationMs = Math.max(1L, openDurationMs);
        this.clock = clock;
    }

    public boolean allowRequest() {
        return clock.getAsLong() >= openUntilMs.get();
    }

    public boolean isOpen() {
        return !allowRequest();
    }

    public void recordSuccess() {
        failureCount.set(0);
    }

    public void recordFailure() {
        int failures = failureCount.incrementAndGet();
        if (failures >= failureThreshold) {
            openUntilMs.set(clock.getAsLong() + openDurationMs);
            failureCount.set(0);
        }
    }
}
