package com.tsl.search.resilience;

public final class Backoff {
    private final long initialMs;
    private final long maxMs;

    public Backoff(long initialMs, long maxMs) {
        this.initialMs = Math.max(0L, initialMs);
        this.maxMs = Math.max(this.initialMs, maxMs);
    }

    public static Backoff fixed(long delayMs) {
        return new Backoff(delayMs, delayMs);
    }

    public long delayAfter(int attempt) {
        if (initialMs == 0L || attempt < 1) {
            return 0L;
        }
        int shift = Math.min(attempt - 1, 30);
        long delay = initialMs << shift;
        if (delay < 0 || delay > maxMs) {
            return maxMs;
        }
        return delay;
    }

    // restores the interrupt flag before rethrowing
    public void pause(int attempt) throws InterruptedException {
        long delay = delayAfter(attempt);
        if (delay <= 0L) {
            return;
        }
        try {
            Thread.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw e;
        }
    }
}
