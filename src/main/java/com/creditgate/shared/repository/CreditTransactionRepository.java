package com.creditgate.shared.repository;

import com.creditgate.shared.model.CreditTransaction;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Repository for the append-only credit transaction log.
 */
@Repository
public interface CreditTransactionRepository extends JpaRepository<CreditTransaction, Long> {

    /**
     * Page through a tenant's transactions, newest first.
     * The id tiebreak keeps the order stable for entries sharing a timestamp.
     */
    @Query(value = """
        SELECT * FROM credit_transactions
        WHERE tenant_id = :tenantId
        ORDER BY created_at DESC, id DESC
        LIMIT :limit OFFSET :offset
        """, nativeQuery = true)
    List<CreditTransaction> findHistory(@Param("tenantId") Long tenantId,
                                        @Param("limit") int limit,
                                        @Param("offset") int offset);

    /**
     * All transactions of a tenant in creation order, used for reconciliation.
     */
    List<CreditTransaction> findByTenantIdOrderByCreatedAtAscIdAsc(Long tenantId);

    @Query("SELECT COALESCE(SUM(t.amount), 0) FROM CreditTransaction t WHERE t.tenantId = :tenantId")
    Long sumAmountsByTenantId(@Param("tenantId") Long tenantId);

    long countByTenantId(Long tenantId);
}
