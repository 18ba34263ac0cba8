package com.creditgate.observability;

/**
 * Interface for metering metrics to support both enabled and disabled modes.
 */
public interface MeteringMetrics {
    void recordRateLimitRejected(String algorithm);
    void recordRateLimitFailOpen();
    void recordCreditsCharged(long credits);
    void recordCacheHit();
    void recordCacheMiss();
    void recordGateLatency(long durationMs, String outcome);
}
