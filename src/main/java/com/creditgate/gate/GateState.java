package com.creditgate.gate;

/**
 * Final state of a gated request, used to tag latency metrics and usage records.
 */
public enum GateState {
    RECORDED,
    FREE,
    RATE_LIMITED,
    UNAUTHORIZED,
    FORBIDDEN,
    INSUFFICIENT_CREDITS,
    FAILED
}
