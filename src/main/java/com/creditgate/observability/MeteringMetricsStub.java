package com.creditgate.observability;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

/**
 * Stub implementation when metrics are disabled.
 */
@Service
@ConditionalOnProperty(name = "app.metrics.enabled", havingValue = "false")
public class MeteringMetricsStub implements MeteringMetrics {

    @Override
    public void recordRateLimitRejected(String algorithm) {
        // No-op when metrics are disabled
    }

    @Override
    public void recordRateLimitFailOpen() {
        // No-op when metrics are disabled
    }

    @Override
    public void recordCreditsCharged(long credits) {
        // No-op when metrics are disabled
    }

    @Override
    public void recordCacheHit() {
        // No-op when metrics are disabled
    }

    @Override
    public void recordCacheMiss() {
        // No-op when metrics are disabled
    }

    @Override
    public void recordGateLatency(long durationMs, String outcome) {
        // No-op when metrics are disabled
    }
}
