package com.creditgate.ratelimit;

import com.creditgate.observability.MeteringMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Per-credential request throttling on top of a {@link RateLimitStore}.
 *
 * The strategy is chosen by app.rate-limit.algorithm. If the store cannot be reached
 * the request is admitted with remaining = limit: availability of the billable service
 * wins over strict throttling. That failure is logged and never surfaced to the caller.
 */
@Service
public class RateLimitService {

    private static final Logger logger = LoggerFactory.getLogger(RateLimitService.class);

    static final String KEY_PREFIX = "rate_limit:";
    static final String SLIDING_KEY_PREFIX = "rate_limit:sliding:";
    static final String LEAKY_KEY_PREFIX = "rate_limit:leaky:";
    static final String BURST_SUFFIX = ":burst";
    static final String SUSTAINED_SUFFIX = ":sustained";

    private final RateLimitStore store;
    private final MeteringMetrics metrics;
    private final Clock clock;
    private final RateLimitAlgorithm algorithm;
    private final RateLimitAlgorithm tieredSubAlgorithm;
    private final int burstLimit;
    private final int burstWindowSeconds;
    private final double leakRatePerSecond;
    private final long leakyBucketTtlSeconds;

    public RateLimitService(
            RateLimitStore store,
            MeteringMetrics metrics,
            Clock clock,
            @Value("${app.rate-limit.algorithm:SLIDING_WINDOW}") RateLimitAlgorithm algorithm,
            @Value("${app.rate-limit.tiered.sub-algorithm:FIXED_WINDOW}") RateLimitAlgorithm tieredSubAlgorithm,
            @Value("${app.rate-limit.tiered.burst-limit:100}") int burstLimit,
            @Value("${app.rate-limit.tiered.burst-window-seconds:60}") int burstWindowSeconds,
            @Value("${app.rate-limit.leaky-bucket.leak-rate:0}") double leakRatePerSecond,
            @Value("${app.rate-limit.leaky-bucket.ttl-seconds:3600}") long leakyBucketTtlSeconds) {
        if (tieredSubAlgorithm != RateLimitAlgorithm.FIXED_WINDOW
                && tieredSubAlgorithm != RateLimitAlgorithm.SLIDING_WINDOW) {
            throw new IllegalArgumentException(
                    "app.rate-limit.tiered.sub-algorithm must be FIXED_WINDOW or SLIDING_WINDOW, got " + tieredSubAlgorithm);
        }
        this.store = store;
        this.metrics = metrics;
        this.clock = clock;
        this.algorithm = algorithm;
        this.tieredSubAlgorithm = tieredSubAlgorithm;
        this.burstLimit = burstLimit;
        this.burstWindowSeconds = burstWindowSeconds;
        this.leakRatePerSecond = leakRatePerSecond;
        this.leakyBucketTtlSeconds = leakyBucketTtlSeconds;
        logger.info("Rate limiter configured: algorithm={}, tieredSubAlgorithm={}, burst={}/{}s",
                algorithm, tieredSubAlgorithm, burstLimit, burstWindowSeconds);
    }

    /**
     * Admits or rejects one request using the configured algorithm.
     *
     * @param credentialId the credential being throttled
     * @param limit requests allowed per window (bucket capacity for LEAKY_BUCKET,
     *              sustained tier for TIERED)
     * @param windowSeconds window length in seconds
     * @return the decision, never null
     */
    public RateLimitDecision admit(String credentialId, int limit, int windowSeconds) {
        return admit(credentialId, limit, windowSeconds, algorithm);
    }

    /**
     * Admits or rejects one request using an explicit algorithm.
     */
    public RateLimitDecision admit(String credentialId, int limit, int windowSeconds, RateLimitAlgorithm algorithm) {
        validate(limit, windowSeconds);
        long nowMs = clock.millis();

        RateLimitDecision decision;
        try {
            decision = evaluate(algorithm, credentialId, limit, windowSeconds, nowMs);
        } catch (RateLimitBackendException e) {
            logger.warn("Rate limit store unavailable, admitting request: credential={}, algorithm={}, error={}",
                    credentialId, algorithm, e.getMessage());
            metrics.recordRateLimitFailOpen();
            return RateLimitDecision.failOpen(limit, Instant.ofEpochMilli(nowMs).plusSeconds(windowSeconds));
        }

        if (!decision.isAllowed()) {
            logger.debug("Rate limit exceeded: credential={}, algorithm={}, retryAfter={}s",
                    credentialId, algorithm, decision.getRetryAfterSeconds());
            metrics.recordRateLimitRejected(algorithm.name());
        }
        return decision;
    }

    /**
     * Reads the credential's current usage without consuming a slot.
     * Falls back to an empty window if the store is unreachable.
     */
    public RateLimitStatus status(String credentialId, int limit, int windowSeconds) {
        validate(limit, windowSeconds);
        long nowMs = clock.millis();
        long windowMs = windowSeconds * 1000L;

        try {
            if (algorithm == RateLimitAlgorithm.LEAKY_BUCKET) {
                double leakRate = leakRate(limit, windowSeconds);
                double level = store.peekBucket(LEAKY_KEY_PREFIX + credentialId, nowMs / 1000.0, leakRate);
                return new RateLimitStatus((int) Math.ceil(level), (int) Math.max(0, Math.floor(limit - level)),
                        limit, Instant.ofEpochMilli(nowMs + (long) (level / leakRate * 1000)));
            }

            String key;
            if (algorithm == RateLimitAlgorithm.FIXED_WINDOW) {
                key = KEY_PREFIX + credentialId;
            } else if (algorithm == RateLimitAlgorithm.SLIDING_WINDOW) {
                key = SLIDING_KEY_PREFIX + credentialId;
            } else {
                key = windowKey(tieredSubAlgorithm, credentialId) + SUSTAINED_SUFFIX;
            }
            WindowSnapshot snapshot = store.peekWindow(key, nowMs, windowMs);
            int used = (int) snapshot.getCount();
            long resetMs = snapshot.getOldestTimestampMs() != null
                    ? snapshot.getOldestTimestampMs() + windowMs
                    : nowMs + windowMs;
            return new RateLimitStatus(used, Math.max(0, limit - used), limit, Instant.ofEpochMilli(resetMs));
        } catch (RateLimitBackendException e) {
            logger.warn("Rate limit store unavailable, reporting empty window: credential={}, error={}",
                    credentialId, e.getMessage());
            return new RateLimitStatus(0, limit, limit, Instant.ofEpochMilli(nowMs + windowMs));
        }
    }

    /**
     * Clears every limiter key of a credential. Store failures propagate to the caller.
     */
    public void reset(String credentialId) {
        String fixed = KEY_PREFIX + credentialId;
        String sliding = SLIDING_KEY_PREFIX + credentialId;
        store.delete(List.of(
                fixed, sliding, LEAKY_KEY_PREFIX + credentialId,
                fixed + BURST_SUFFIX, fixed + SUSTAINED_SUFFIX,
                sliding + BURST_SUFFIX, sliding + SUSTAINED_SUFFIX));
        logger.info("Rate limit reset for credential {}", credentialId);
    }

    private RateLimitDecision evaluate(RateLimitAlgorithm algorithm, String credentialId,
                                       int limit, int windowSeconds, long nowMs) {
        switch (algorithm) {
            case FIXED_WINDOW:
                return fixedWindow(KEY_PREFIX + credentialId, limit, windowSeconds, nowMs);
            case SLIDING_WINDOW:
                return slidingWindow(SLIDING_KEY_PREFIX + credentialId, limit, windowSeconds, nowMs);
            case LEAKY_BUCKET:
                return leakyBucket(LEAKY_KEY_PREFIX + credentialId, limit, windowSeconds, nowMs);
            case TIERED:
                return tiered(credentialId, limit, windowSeconds, nowMs);
            default:
                throw new IllegalArgumentException("Unsupported algorithm: " + algorithm);
        }
    }

    private RateLimitDecision fixedWindow(String key, int limit, int windowSeconds, long nowMs) {
        long windowMs = windowSeconds * 1000L;
        WindowSnapshot snapshot = store.recordInTransaction(key, member(nowMs), nowMs, windowMs, limit);
        return toDecision(snapshot, limit, windowMs, nowMs);
    }

    private RateLimitDecision slidingWindow(String key, int limit, int windowSeconds, long nowMs) {
        long windowMs = windowSeconds * 1000L;
        WindowSnapshot snapshot = store.recordAtomically(key, member(nowMs), nowMs, windowMs, limit);
        return toDecision(snapshot, limit, windowMs, nowMs);
    }

    private RateLimitDecision leakyBucket(String key, int capacity, int windowSeconds, long nowMs) {
        double leakRate = leakRate(capacity, windowSeconds);
        BucketSnapshot bucket = store.drip(key, nowMs / 1000.0, capacity, leakRate, leakyBucketTtlSeconds);
        double level = bucket.getLevel();

        if (bucket.isAdmitted()) {
            // Fully drained once the current level has leaked away
            long drainMs = (long) Math.ceil(level / leakRate * 1000);
            return RateLimitDecision.allow(capacity, (int) Math.floor(capacity - level),
                    Instant.ofEpochMilli(nowMs + drainMs));
        }

        long retryAfter = (long) Math.ceil((level - capacity + 1) / leakRate);
        return RateLimitDecision.reject(capacity, Instant.ofEpochMilli(nowMs).plusSeconds(retryAfter), retryAfter);
    }

    private RateLimitDecision tiered(String credentialId, int sustainedLimit, int sustainedWindowSeconds, long nowMs) {
        String baseKey = windowKey(tieredSubAlgorithm, credentialId);
        RateLimitDecision burst = subWindow(baseKey + BURST_SUFFIX, burstLimit, burstWindowSeconds, nowMs);
        if (!burst.isAllowed()) {
            return burst;
        }
        return subWindow(baseKey + SUSTAINED_SUFFIX, sustainedLimit, sustainedWindowSeconds, nowMs);
    }

    private RateLimitDecision subWindow(String key, int limit, int windowSeconds, long nowMs) {
        return tieredSubAlgorithm == RateLimitAlgorithm.SLIDING_WINDOW
                ? slidingWindow(key, limit, windowSeconds, nowMs)
                : fixedWindow(key, limit, windowSeconds, nowMs);
    }

    private static RateLimitDecision toDecision(WindowSnapshot snapshot, int limit, long windowMs, long nowMs) {
        if (snapshot.isAdmitted()) {
            return RateLimitDecision.allow(limit, (int) (limit - snapshot.getCount()),
                    Instant.ofEpochMilli(nowMs + windowMs));
        }
        long oldest = snapshot.getOldestTimestampMs() != null ? snapshot.getOldestTimestampMs() : nowMs;
        long resetMs = oldest + windowMs;
        long retryAfter = (long) Math.ceil((resetMs - nowMs) / 1000.0);
        return RateLimitDecision.reject(limit, Instant.ofEpochMilli(resetMs), retryAfter);
    }

    private double leakRate(int capacity, int windowSeconds) {
        return leakRatePerSecond > 0 ? leakRatePerSecond : (double) capacity / windowSeconds;
    }

    private static String windowKey(RateLimitAlgorithm algorithm, String credentialId) {
        return algorithm == RateLimitAlgorithm.SLIDING_WINDOW
                ? SLIDING_KEY_PREFIX + credentialId
                : KEY_PREFIX + credentialId;
    }

    private static String member(long nowMs) {
        return nowMs + "-" + UUID.randomUUID();
    }

    private static void validate(int limit, int windowSeconds) {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be positive, got " + limit);
        }
        if (windowSeconds <= 0) {
            throw new IllegalArgumentException("windowSeconds must be positive, got " + windowSeconds);
        }
    }
}
