package com.creditgate.shared.repository;

import com.creditgate.shared.model.QueryKind;
import com.creditgate.shared.model.SearchCacheEntry;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Optional;

/**
 * Repository for cached search results with atomic upsert and hit tracking.
 * Keys are expected to be normalized by the caller.
 */
@Repository
public interface SearchCacheEntryRepository extends JpaRepository<SearchCacheEntry, Long> {

    @Query("""
        SELECT e FROM SearchCacheEntry e
        WHERE e.tenantId = :tenantId
        AND e.searchTerm = :searchTerm
        AND e.queryKind = :queryKind
        """)
    Optional<SearchCacheEntry> findByKey(@Param("tenantId") Long tenantId,
                                         @Param("searchTerm") String searchTerm,
                                         @Param("queryKind") QueryKind queryKind);

    /**
     * Record a hit on an existing entry in a single statement.
     * @return number of rows touched, 0 on a miss
     */
    @Modifying(clearAutomatically = true)
    @Query(value = """
        UPDATE search_result_cache
        SET access_count = access_count + 1, last_accessed_at = :now
        WHERE tenant_id = :tenantId AND search_term = :searchTerm AND search_type = :queryKind
        """, nativeQuery = true)
    int recordHit(@Param("tenantId") Long tenantId,
                  @Param("searchTerm") String searchTerm,
                  @Param("queryKind") String queryKind,
                  @Param("now") Instant now);

    /**
     * Insert a new entry or refresh an existing one. On conflict the payload, count and state
     * are overwritten and the access counters are bumped, never reset.
     */
    @Modifying(clearAutomatically = true)
    @Query(value = """
        INSERT INTO search_result_cache
            (tenant_id, search_term, search_type, result_payload, result_count, result_state,
             first_seen_at, last_accessed_at, access_count)
        VALUES (:tenantId, :searchTerm, :queryKind, CAST(:payload AS jsonb), :resultCount, :resultState,
                :now, :now, 1)
        ON CONFLICT (tenant_id, search_term, search_type) DO UPDATE SET
            result_payload = EXCLUDED.result_payload,
            result_count = EXCLUDED.result_count,
            result_state = EXCLUDED.result_state,
            last_accessed_at = EXCLUDED.last_accessed_at,
            access_count = search_result_cache.access_count + 1
        """, nativeQuery = true)
    int upsert(@Param("tenantId") Long tenantId,
               @Param("searchTerm") String searchTerm,
               @Param("queryKind") String queryKind,
               @Param("payload") String payload,
               @Param("resultCount") int resultCount,
               @Param("resultState") String resultState,
               @Param("now") Instant now);

    /**
     * Delete entries not accessed since the cutoff (maintenance sweep).
     */
    @Modifying
    @Query("DELETE FROM SearchCacheEntry e WHERE e.lastAccessedAt < :cutoff")
    int deleteByLastAccessedAtBefore(@Param("cutoff") Instant cutoff);

    long countByTenantId(Long tenantId);

    @Query("SELECT COALESCE(SUM(e.accessCount - 1), 0) FROM SearchCacheEntry e WHERE e.tenantId = :tenantId")
    Long sumCacheHitsByTenantId(@Param("tenantId") Long tenantId);

    @Query("SELECT MAX(e.lastAccessedAt) FROM SearchCacheEntry e WHERE e.tenantId = :tenantId AND e.accessCount > 1")
    Instant findLastHitAt(@Param("tenantId") Long tenantId);
}
