package com.creditgate.ratelimit;

/**
 * Admission strategies sharing the {@link RateLimitService#admit} contract.
 */
public enum RateLimitAlgorithm {
    /** Ordered set of timestamps updated in one MULTI/EXEC transaction. */
    FIXED_WINDOW,
    /** Same accounting evaluated as one server-side script. */
    SLIDING_WINDOW,
    /** Level that drains at a constant rate and fills by one per admitted request. */
    LEAKY_BUCKET,
    /** Short burst window checked first, then a long sustained window. */
    TIERED
}
