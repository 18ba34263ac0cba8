package com.creditgate.shared.model;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;
import org.hibernate.annotations.Check;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.Instant;

/**
 * Entity holding the authoritative credit balance of a tenant.
 * Maps to the credit_accounts table.
 * The row is the cache of truth for the balance; credit_transactions is the audit trail.
 */
@Entity
@Table(name = "credit_accounts", indexes = {
    @Index(name = "idx_credit_accounts_tenant", columnList = "tenant_id", unique = true)
})
@Check(constraints = "balance >= 0 AND total_purchased >= 0 AND total_used >= 0 "
        + "AND balance = total_purchased - total_used")
public class CreditAccount {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "tenant_id", nullable = false, unique = true, updatable = false)
    @NotNull
    private Long tenantId;

    @Column(name = "balance", nullable = false)
    private long balance;

    @Column(name = "total_purchased", nullable = false)
    private long totalPurchased;

    @Column(name = "total_used", nullable = false)
    private long totalUsed;

    @Column(name = "last_purchase_at")
    private Instant lastPurchaseAt;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    protected CreditAccount() {
    }

    public CreditAccount(Long tenantId) {
        this.tenantId = tenantId;
    }

    /**
     * Applies a usage charge. Callers must hold the row lock and have checked the balance.
     */
    public void debit(long amount) {
        if (amount > balance) {
            throw new IllegalStateException("Debit of " + amount + " exceeds balance " + balance);
        }
        this.balance -= amount;
        this.totalUsed += amount;
    }

    /**
     * Applies a positive balance change. Only purchases move lastPurchaseAt.
     */
    public void credit(long amount, TransactionKind kind, Instant now) {
        this.balance += amount;
        this.totalPurchased += amount;
        if (kind == TransactionKind.PURCHASE) {
            this.lastPurchaseAt = now;
        }
    }

    public Long getId() {
        return id;
    }

    public Long getTenantId() {
        return tenantId;
    }

    public long getBalance() {
        return balance;
    }

    public long getTotalPurchased() {
        return totalPurchased;
    }

    public long getTotalUsed() {
        return totalUsed;
    }

    public Instant getLastPurchaseAt() {
        return lastPurchaseAt;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }
}
