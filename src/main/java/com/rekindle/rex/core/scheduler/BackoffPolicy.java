package com.rekindle.rex.core.scheduler;

import java.time.Duration;

/**
 * Exponential backoff: {@code min(base * 2^retryCount, cap)}.
 */
public record BackoffPolicy(Duration base, Duration cap) {

    public BackoffPolicy {
        if (base.isNegative() || cap.isNegative()) {
            throw new IllegalArgumentException("backoff durations must be non-negative");
        }
    }

    public Duration delayFor(int retryCount) {
        if (retryCount >= 62) {
            return cap;
        }
        long multiplier = 1L << Math.max(0, retryCount);
        long baseMillis = base.toMillis();
        if (baseMillis > 0 && multiplier > Long.MAX_VALUE / baseMillis) {
            return cap;
        }
        Duration delay = Duration.ofMillis(baseMillis * multiplier);
        return delay.compareTo(cap) > 0 ? cap : delay;
    }
}
