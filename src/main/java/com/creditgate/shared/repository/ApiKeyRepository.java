package com.creditgate.shared.repository;

import com.creditgate.shared.model.ApiKey;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Repository for ApiKey entities.
 */
@Repository
public interface ApiKeyRepository extends JpaRepository<ApiKey, Long> {

    /**
     * Find a credential by the HMAC of its raw key.
     * @param keyHmac base64 HMAC-SHA256 of the raw key
     * @return Optional containing the key if found
     */
    Optional<ApiKey> findByKeyHmac(String keyHmac);

    List<ApiKey> findByTenantId(Long tenantId);

    @Modifying
    @Query("UPDATE ApiKey k SET k.lastUsedAt = :now WHERE k.id = :id")
    int touchLastUsed(@Param("id") Long id, @Param("now") Instant now);
}
