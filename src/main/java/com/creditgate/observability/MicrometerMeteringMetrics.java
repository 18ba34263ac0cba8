package com.creditgate.observability;

import com.creditgate.util.Strings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.util.concurrent.TimeUnit;

/**
 * Service for emitting metering metrics through Micrometer.
 * Active unless app.metrics.enabled=false.
 *
 * Metrics:
 * - creditgate.ratelimit.rejected: Counter of throttled requests, tagged by algorithm
 * - creditgate.ratelimit.fail_open: Counter of requests admitted because the store was unreachable
 * - creditgate.credits.charged: Counter of credits deducted
 * - creditgate.cache.hits / creditgate.cache.misses: Result cache lookups
 * - creditgate.gate.latency: Timer for gated requests, tagged by outcome
 */
@Service
@ConditionalOnProperty(name = "app.metrics.enabled", havingValue = "true", matchIfMissing = true)
public class MicrometerMeteringMetrics implements MeteringMetrics {

    private static final Logger logger = LoggerFactory.getLogger(MicrometerMeteringMetrics.class);
    private static final String SERVICE_TAG = "creditgate";

    private final MeterRegistry meterRegistry;
    private final Counter failOpenCounter;
    private final Counter creditsChargedCounter;
    private final Counter cacheHitCounter;
    private final Counter cacheMissCounter;

    public MicrometerMeteringMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        this.failOpenCounter = Counter.builder("creditgate.ratelimit.fail_open")
                .description("Requests admitted because the rate limit store was unavailable")
                .tag("service", SERVICE_TAG)
                .register(meterRegistry);
        this.creditsChargedCounter = Counter.builder("creditgate.credits.charged")
                .description("Credits deducted from tenant balances")
                .tag("service", SERVICE_TAG)
                .register(meterRegistry);
        this.cacheHitCounter = Counter.builder("creditgate.cache.hits")
                .description("Result cache hits")
                .tag("service", SERVICE_TAG)
                .register(meterRegistry);
        this.cacheMissCounter = Counter.builder("creditgate.cache.misses")
                .description("Result cache misses")
                .tag("service", SERVICE_TAG)
                .register(meterRegistry);
        logger.info("Micrometer metering metrics initialized");
    }

    @Override
    public void recordRateLimitRejected(String algorithm) {
        Counter.builder("creditgate.ratelimit.rejected")
                .description("Requests rejected by the rate limiter")
                .tag("service", SERVICE_TAG)
                .tag("algorithm", Strings.safe(algorithm))
                .register(meterRegistry)
                .increment();
    }

    @Override
    public void recordRateLimitFailOpen() {
        failOpenCounter.increment();
    }

    @Override
    public void recordCreditsCharged(long credits) {
        creditsChargedCounter.increment(credits);
    }

    @Override
    public void recordCacheHit() {
        cacheHitCounter.increment();
    }

    @Override
    public void recordCacheMiss() {
        cacheMissCounter.increment();
    }

    @Override
    public void recordGateLatency(long durationMs, String outcome) {
        Timer.builder("creditgate.gate.latency")
                .description("Latency of gated requests")
                .tag("service", SERVICE_TAG)
                .tag("outcome", Strings.safe(outcome))
                .register(meterRegistry)
                .record(durationMs, TimeUnit.MILLISECONDS);
    }
}
