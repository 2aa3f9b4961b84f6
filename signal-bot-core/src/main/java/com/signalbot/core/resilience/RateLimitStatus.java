package com.signalbot.core.resilience;

import java.time.Instant;

/**
 * Snapshot of a token bucket.
 *
 * @param resetAt time of the last refill plus one window
 */
public record RateLimitStatus(String name, int remaining, int capacity, Instant resetAt, int queued) {

    public boolean isLow() {
        return remaining < capacity * RateLimiter.LOW_QUOTA_FRACTION;
    }
}
