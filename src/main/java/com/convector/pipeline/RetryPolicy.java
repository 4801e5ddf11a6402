package com.convector.pipeline;

import java.time.Duration;

/**
 * Fixed attempt count with a fixed delay between attempts.
 */
public record RetryPolicy(int maxAttempts, Duration delay) {
    public static final RetryPolicy DEFAULT = new RetryPolicy(3, Duration.ofSeconds(5));

    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        }
        if (delay == null || delay.isNegative()) {
            throw new IllegalArgumentException("delay must be >= 0");
        }
    }
}
