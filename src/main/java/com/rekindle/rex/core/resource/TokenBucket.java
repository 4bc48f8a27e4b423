package com.rekindle.rex.core.resource;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Token bucket refilled in whole steps on a fixed schedule.
 * <p>
 * Refill is computed lazily from the clock: every elapsed {@code refillPeriod} adds
 * {@code refillAmount} tokens, capped at {@code capacity}. Not thread-safe on its own;
 * {@link ApiQuotaPool} serialises access.
 */
final class TokenBucket {

    private final long capacity;
    private final long refillAmount;
    private final Duration refillPeriod;
    private final Clock clock;

    private long tokens;
    private Instant lastRefill;

    TokenBucket(long capacity, long refillAmount, Duration refillPeriod, Clock clock) {
        if (capacity <= 0 || refillAmount <= 0 || refillPeriod.isZero() || refillPeriod.isNegative()) {
            throw new IllegalArgumentException("invalid bucket: capacity=" + capacity
                    + " refill=" + refillAmount + "/" + refillPeriod);
        }
        this.capacity = capacity;
        this.refillAmount = refillAmount;
        this.refillPeriod = refillPeriod;
        this.clock = clock;
        this.tokens = capacity;
        this.lastRefill = clock.instant();
    }

    boolean tryConsume(long amount) {
        refill();
        if (amount > tokens) {
            return false;
        }
        tokens -= amount;
        return true;
    }

    long available() {
        refill();
        return tokens;
    }

    long capacity() {
        return capacity;
    }

    double utilization() {
        return 1.0 - (double) available() / capacity;
    }

    private void refill() {
        Instant now = clock.instant();
        long periodNanos = refillPeriod.toNanos();
        long elapsed = Duration.between(lastRefill, now).toNanos();
        if (elapsed < periodNanos) {
            return;
        }
        long periods = elapsed / periodNanos;
        tokens = Math.min(capacity, tokens + Math.min(periods, capacity) * refillAmount);
        lastRefill = lastRefill.plusNanos(periods * periodNanos);
    }
}
