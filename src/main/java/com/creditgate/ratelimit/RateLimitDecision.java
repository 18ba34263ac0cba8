package com.creditgate.ratelimit;

import java.time.Instant;

/**
 * Outcome of an admission check.
 * retryAfterSeconds is only set on rejections.
 */
public final class RateLimitDecision {

    private final boolean allowed;
    private final int limit;
    private final int remaining;
    private final Instant resetAt;
    private final Long retryAfterSeconds;
    private final boolean failedOpen;

    private RateLimitDecision(boolean allowed, int limit, int remaining, Instant resetAt,
                              Long retryAfterSeconds, boolean failedOpen) {
        this.allowed = allowed;
        this.limit = limit;
        this.remaining = remaining;
        this.resetAt = resetAt;
        this.retryAfterSeconds = retryAfterSeconds;
        this.failedOpen = failedOpen;
    }

    public static RateLimitDecision allow(int limit, int remaining, Instant resetAt) {
        return new RateLimitDecision(true, limit, Math.max(0, remaining), resetAt, null, false);
    }

    public static RateLimitDecision reject(int limit, Instant resetAt, long retryAfterSeconds) {
        return new RateLimitDecision(false, limit, 0, resetAt, Math.max(1L, retryAfterSeconds), false);
    }

    /**
     * Admit decision used when the backing store could not be reached.
     */
    public static RateLimitDecision failOpen(int limit, Instant resetAt) {
        return new RateLimitDecision(true, limit, limit, resetAt, null, true);
    }

    public boolean isAllowed() {
        return allowed;
    }

    public int getLimit() {
        return limit;
    }

    public int getRemaining() {
        return remaining;
    }

    public Instant getResetAt() {
        return resetAt;
    }

    public Long getRetryAfterSeconds() {
        return retryAfterSeconds;
    }

    public boolean isFailedOpen() {
        return failedOpen;
    }

    @Override
    public String toString() {
        return "RateLimitDecision{allowed=" + allowed + ", limit=" + limit + ", remaining=" + remaining
                + ", resetAt=" + resetAt + ", retryAfterSeconds=" + retryAfterSeconds
                + ", failedOpen=" + failedOpen + '}';
    }
}
