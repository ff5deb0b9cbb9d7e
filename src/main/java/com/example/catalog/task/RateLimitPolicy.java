package com.example.catalog.task;

import java.time.Duration;

/**
 * Admission policy of a named limiter: at most {@code permits} operations per
 * {@code window}.
 */
public record RateLimitPolicy(int permits, Duration window) {

    public RateLimitPolicy {
        if (permits <= 0) {
            throw new IllegalArgumentException("permits must be positive: " + permits);
        }
        if (window == null || window.isZero() || window.isNegative()) {
            throw new IllegalArgumentException("window must be positive: " + window);
        }
    }

    public double permitsPerSecond() {
        return permits * 1_000_000_000d / window.toNanos();
    }
}
