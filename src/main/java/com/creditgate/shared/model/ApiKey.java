package com.creditgate.shared.model;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import org.hibernate.annotations.CreationTimestamp;

import java.time.Instant;
import java.util.Arrays;
import java.util.List;

/**
 * Entity representing an API credential issued to a tenant.
 * Only the HMAC of the raw key is stored. Maps to the api_keys table.
 */
@Entity
@Table(name = "api_keys", indexes = {
    @Index(name = "idx_api_keys_hash", columnList = "key_hmac", unique = true),
    @Index(name = "idx_api_keys_tenant", columnList = "tenant_id")
})
public class ApiKey {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "tenant_id", nullable = false, updatable = false)
    @NotNull
    private Long tenantId;

    @Column(name = "key_prefix", length = 12, nullable = false, updatable = false)
    @Size(max = 12)
    private String keyPrefix;

    @Column(name = "key_hmac", length = 64, nullable = false, unique = true, updatable = false)
    @NotNull
    private String keyHmac;

    @Column(name = "name", length = 100, nullable = false)
    @Size(max = 100)
    private String name;

    // Space separated, "*" grants every scope
    @Column(name = "scopes", length = 500, nullable = false)
    private String scopes = "";

    @Column(name = "rate_limit", nullable = false)
    private Integer rateLimit = 1000;

    @Column(name = "is_active", nullable = false)
    private boolean active = true;

    @Column(name = "expires_at")
    private Instant expiresAt;

    @Column(name = "last_used_at")
    private Instant lastUsedAt;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    protected ApiKey() {
    }

    public ApiKey(Long tenantId, String keyPrefix, String keyHmac, String name) {
        this.tenantId = tenantId;
        this.keyPrefix = keyPrefix;
        this.keyHmac = keyHmac;
        this.name = name;
    }

    public boolean hasScope(String scope) {
        List<String> granted = getScopeList();
        return granted.contains("*") || granted.contains(scope);
    }

    public boolean isExpired(Instant now) {
        return expiresAt != null && now.isAfter(expiresAt);
    }

    public List<String> getScopeList() {
        if (scopes == null || scopes.isBlank()) {
            return List.of();
        }
        return Arrays.stream(scopes.trim().split("\\s+")).toList();
    }

    public Long getId() {
        return id;
    }

    public Long getTenantId() {
        return tenantId;
    }

    public String getKeyPrefix() {
        return keyPrefix;
    }

    public String getKeyHmac() {
        return keyHmac;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getScopes() {
        return scopes;
    }

    public void setScopes(String scopes) {
        this.scopes = scopes;
    }

    public Integer getRateLimit() {
        return rateLimit;
    }

    public void setRateLimit(Integer rateLimit) {
        this.rateLimit = rateLimit;
    }

    public boolean isActive() {
        return active;
    }

    public void setActive(boolean active) {
        this.active = active;
    }

    public Instant getExpiresAt() {
        return expiresAt;
    }

    public void setExpiresAt(Instant expiresAt) {
        this.expiresAt = expiresAt;
    }

    public Instant getLastUsedAt() {
        return lastUsedAt;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }
}
