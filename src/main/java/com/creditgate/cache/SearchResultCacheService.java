package com.creditgate.cache;

import com.creditgate.shared.model.QueryKind;
import com.creditgate.shared.model.ResultState;
import com.creditgate.shared.model.SearchCacheEntry;
import com.creditgate.shared.repository.SearchCacheEntryRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Locale;
import java.util.Optional;

/**
 * Per-tenant cache of the most recent result for a (normalized query, kind) pair.
 *
 * Queries are normalized by trimming and lower-casing, so "RobloxUser" and
 * "robloxuser " share one entry. A hit bumps accessCount and lastAccessedAt in a
 * single UPDATE statement; concurrent hits never lose an increment.
 */
@Service
public class SearchResultCacheService {

    private static final Logger logger = LoggerFactory.getLogger(SearchResultCacheService.class);

    private final SearchCacheEntryRepository repository;
    private final Clock clock;

    public SearchResultCacheService(SearchCacheEntryRepository repository, Clock clock) {
        this.repository = repository;
        this.clock = clock;
    }

    public static String normalize(String query) {
        if (query == null) {
            throw new IllegalArgumentException("query must not be null");
        }
        return query.trim().toLowerCase(Locale.ROOT);
    }

    /**
     * Looks up a cached result and records the hit.
     *
     * @return the entry with its counters already bumped, empty on a miss
     */
    @Transactional
    public Optional<SearchCacheEntry> lookup(Long tenantId, String query, QueryKind kind) {
        String term = normalize(query);
        int touched = repository.recordHit(tenantId, term, kind.name(), Instant.now(clock));
        if (touched == 0) {
            logger.debug("Cache miss: tenant={}, kind={}, term='{}'", tenantId, kind, term);
            return Optional.empty();
        }
        return repository.findByKey(tenantId, term, kind);
    }

    /**
     * Stores a fresh result, replacing any existing entry for the same key.
     *
     * @param payload result serialized as JSON
     * @throws CacheWriteException if the write fails
     */
    @Transactional
    public SearchCacheEntry store(Long tenantId, String query, QueryKind kind,
                                  String payload, int resultCount, ResultState state) {
        String term = normalize(query);
        try {
            repository.upsert(tenantId, term, kind.name(), payload, resultCount, state.name(), Instant.now(clock));
            return repository.findByKey(tenantId, term, kind)
                    .orElseThrow(() -> new IllegalStateException("Upserted cache entry not found"));
        } catch (DataAccessException | IllegalStateException e) {
            throw new CacheWriteException("Failed to cache result for tenant " + tenantId, e);
        }
    }

    /**
     * Deletes entries not accessed within the last maxAgeDays days.
     * @return number of entries removed
     */
    @Transactional
    public int sweep(int maxAgeDays) {
        if (maxAgeDays <= 0) {
            throw new IllegalArgumentException("maxAgeDays must be positive, got " + maxAgeDays);
        }
        Instant cutoff = Instant.now(clock).minus(maxAgeDays, ChronoUnit.DAYS);
        int deleted = repository.deleteByLastAccessedAtBefore(cutoff);
        logger.info("Cache sweep removed {} entries idle since before {}", deleted, cutoff);
        return deleted;
    }

    @Transactional(readOnly = true)
    public CacheStats stats(Long tenantId) {
        Long hits = repository.sumCacheHitsByTenantId(tenantId);
        return new CacheStats(
                repository.countByTenantId(tenantId),
                hits != null ? hits : 0L,
                repository.findLastHitAt(tenantId));
    }
}
