package com.creditgate.ratelimit;

/**
 * Thrown when an admission check rejects a request.
 */
public class RateLimitExceededException extends RuntimeException {

    private final RateLimitDecision decision;

    public RateLimitExceededException(RateLimitDecision decision) {
        super("Rate limit exceeded, retry after " + decision.getRetryAfterSeconds() + "s");
        this.decision = decision;
    }

    public RateLimitDecision getDecision() {
        return decision;
    }
}
