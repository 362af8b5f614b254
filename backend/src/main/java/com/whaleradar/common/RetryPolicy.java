package com.whaleradar.common;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Backoff schedule for upstream ledger calls: base × 2^attempt, spread by ±jitterFactor.
 *
 * @param maxAttempts total tries per call, first one included
 */
public record RetryPolicy(long baseDelayMs, double jitterFactor, int maxAttempts) {

    /** Doubling stops here so a misconfigured attempt count cannot overflow the delay. */
    private static final int MAX_DOUBLINGS = 20;

    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1, got " + maxAttempts);
        }
        if (baseDelayMs < 0) {
            throw new IllegalArgumentException("baseDelayMs must not be negative, got " + baseDelayMs);
        }
    }

    /** Sleep before the retry that follows zero-based {@code attempt}. */
    public long delayMs(int attempt) {
        long nominal = baseDelayMs << Math.min(Math.max(attempt, 0), MAX_DOUBLINGS);
        if (jitterFactor <= 0) {
            return nominal;
        }
        double spread = (ThreadLocalRandom.current().nextDouble() * 2.0 - 1.0) * jitterFactor;
        return Math.max(0L, Math.round(nominal * (1.0 + spread)));
    }
}
