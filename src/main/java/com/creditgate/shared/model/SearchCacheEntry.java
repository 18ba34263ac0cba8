package com.creditgate.shared.model;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;

/**
 * Most recent result of a (tenant, normalized query, kind) lookup.
 * Maps to the search_result_cache table.
 */
@Entity
@Table(name = "search_result_cache",
    uniqueConstraints = @UniqueConstraint(name = "uq_search_cache_key",
            columnNames = {"tenant_id", "search_term", "search_type"}),
    indexes = {
        @Index(name = "idx_search_cache_last_accessed", columnList = "last_accessed_at")
    })
public class SearchCacheEntry {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "tenant_id", nullable = false, updatable = false)
    @NotNull
    private Long tenantId;

    @Column(name = "search_term", length = 500, nullable = false, updatable = false)
    @NotNull
    private String searchTerm;

    @Enumerated(EnumType.STRING)
    @Column(name = "search_type", length = 20, nullable = false, updatable = false)
    @NotNull
    private QueryKind queryKind;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "result_payload", columnDefinition = "JSONB", nullable = false)
    private String resultPayload;

    @Column(name = "result_count", nullable = false)
    private Integer resultCount = 0;

    @Enumerated(EnumType.STRING)
    @Column(name = "result_state", length = 20, nullable = false)
    private ResultState resultState;

    @Column(name = "first_seen_at", nullable = false, updatable = false)
    private Instant firstSeenAt;

    @Column(name = "last_accessed_at", nullable = false)
    private Instant lastAccessedAt;

    @Column(name = "access_count", nullable = false)
    private Integer accessCount = 1;

    protected SearchCacheEntry() {
    }

    public Long getId() {
        return id;
    }

    public Long getTenantId() {
        return tenantId;
    }

    public String getSearchTerm() {
        return searchTerm;
    }

    public QueryKind getQueryKind() {
        return queryKind;
    }

    public String getResultPayload() {
        return resultPayload;
    }

    public Integer getResultCount() {
        return resultCount;
    }

    public ResultState getResultState() {
        return resultState;
    }

    public Instant getFirstSeenAt() {
        return firstSeenAt;
    }

    public Instant getLastAccessedAt() {
        return lastAccessedAt;
    }

    public Integer getAccessCount() {
        return accessCount;
    }
}
