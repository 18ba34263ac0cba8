package com.creditgate.ratelimit;

import java.time.Instant;

/**
 * Read-only view of a credential's current window.
 */
public final class RateLimitStatus {

    private final int used;
    private final int remaining;
    private final int limit;
    private final Instant resetAt;

    public RateLimitStatus(int used, int remaining, int limit, Instant resetAt) {
        this.used = used;
        this.remaining = remaining;
        this.limit = limit;
        this.resetAt = resetAt;
    }

    public int getUsed() {
        return used;
    }

    public int getRemaining() {
        return remaining;
    }

    public int getLimit() {
        return limit;
    }

    public Instant getResetAt() {
        return resetAt;
    }
}
