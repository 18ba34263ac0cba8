package com.creditgate.cache;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodically removes cache entries that have not been read for app.cache.max-age-days.
 */
@Component
@ConditionalOnProperty(prefix = "app.maintenance", name = "enabled", havingValue = "true", matchIfMissing = true)
public class SearchCacheCleanupTask {

    private static final Logger logger = LoggerFactory.getLogger(SearchCacheCleanupTask.class);

    private final SearchResultCacheService cacheService;
    private final int maxAgeDays;

    public SearchCacheCleanupTask(SearchResultCacheService cacheService,
                                  @Value("${app.cache.max-age-days:30}") int maxAgeDays) {
        this.cacheService = cacheService;
        this.maxAgeDays = maxAgeDays;
        logger.info("SearchCacheCleanupTask initialized: maxAgeDays={}", maxAgeDays);
    }

    @Scheduled(fixedDelayString = "${app.cache.sweep-interval-ms:3600000}",
               initialDelayString = "${app.cache.sweep-interval-ms:3600000}")
    public void sweepIdleEntries() {
        try {
            cacheService.sweep(maxAgeDays);
        } catch (Exception e) {
            logger.error("Error during cache sweep", e);
        }
    }
}
