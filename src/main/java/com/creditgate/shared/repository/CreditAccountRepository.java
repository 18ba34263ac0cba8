package com.creditgate.shared.repository;

import com.creditgate.shared.model.CreditAccount;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;

/**
 * Repository for CreditAccount entities.
 */
@Repository
public interface CreditAccountRepository extends JpaRepository<CreditAccount, Long> {

    /**
     * Find a tenant's account without locking.
     * @param tenantId the tenant id
     * @return Optional containing the account if it exists
     */
    Optional<CreditAccount> findByTenantId(Long tenantId);

    /**
     * Find a tenant's account and lock its row exclusively (SELECT ... FOR UPDATE)
     * until the surrounding transaction ends. Every balance mutation goes through this.
     * @param tenantId the tenant id
     * @return Optional containing the locked account
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT a FROM CreditAccount a WHERE a.tenantId = :tenantId")
    Optional<CreditAccount> findByTenantIdForUpdate(@Param("tenantId") Long tenantId);

    /**
     * Create a zero-balance account unless one already exists.
     * @param tenantId the tenant id
     * @return 1 if a row was inserted, 0 if the account already existed
     */
    @Modifying
    @Query(value = """
        INSERT INTO credit_accounts (tenant_id, balance, total_purchased, total_used, created_at, updated_at)
        VALUES (:tenantId, 0, 0, 0, now(), now())
        ON CONFLICT (tenant_id) DO NOTHING
        """, nativeQuery = true)
    int insertIfAbsent(@Param("tenantId") Long tenantId);
}
