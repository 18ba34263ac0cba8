package com.creditgate.ratelimit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;

/**
 * Periodically drops idle keys from the in-memory limiter store. The Redis store
 * relies on key TTLs instead.
 */
@Component
@ConditionalOnProperty(name = "app.rate-limit.store", havingValue = "memory")
public class InMemoryRateLimitCleanupTask {

    private static final Logger logger = LoggerFactory.getLogger(InMemoryRateLimitCleanupTask.class);

    private final InMemoryRateLimitStore store;
    private final Clock clock;

    public InMemoryRateLimitCleanupTask(InMemoryRateLimitStore store, Clock clock) {
        this.store = store;
        this.clock = clock;
    }

    @Scheduled(fixedDelayString = "${app.rate-limit.memory.prune-interval-ms:60000}",
               initialDelayString = "${app.rate-limit.memory.prune-interval-ms:60000}")
    public void evictIdleKeys() {
        try {
            int removed = store.evictExpired(clock.millis());
            if (removed > 0) {
                logger.debug("Evicted {} idle rate limit keys", removed);
            }
        } catch (Exception e) {
            logger.error("Error during rate limit key eviction", e);
        }
    }
}
