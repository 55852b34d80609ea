package com.tsl.search.resilience;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.LongSupplier;

public class CircuitBreaker {
    private final String name;
    private final int failureThreshold;
    private final long openDurationMs;
    private final LongSupplier clock;
    private final AtomicInteger failureCount = new AtomicInteger(0);
    private final AtomicLong openUntilMs = new AtomicLong(0L);

    public CircuitBreaker(String name, int failureThreshold, long openDurationMs) {
        this(name, failureThreshold, openDurationMs, System::currentTimeMillis);
    }

    public CircuitBreaker(String name, int failureThreshold, long openDurationMs, LongSupplier clock) {
        this.name = name;
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

    // true when this failure tripped the breaker open
    public boolean recordFailure() {
        int failures = failureCount.incrementAndGet();
        if (failures >= failureThreshold) {
            openUntilMs.set(clock.getAsLong() + openDurationMs);
            failureCount.set(0);
            return true;
        }
        return false;
    }

    public void reset() {
        failureCount.set(0);
        openUntilMs.set(0L);
    }

    public String getName() {
        return name;
    }

    public int getConsecutiveFailures() {
        return failureCount.get();
    }
}
