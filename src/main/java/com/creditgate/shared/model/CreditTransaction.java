package com.creditgate.shared.model;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;
import org.hibernate.annotations.Check;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.Immutable;

import java.time.Instant;

/**
 * Append-only ledger entry, one per balance change.
 * Maps to the credit_transactions table. Rows are never updated or deleted.
 */
@Entity
@Immutable
@Table(name = "credit_transactions", indexes = {
    @Index(name = "idx_credit_tx_tenant_created", columnList = "tenant_id, created_at"),
    @Index(name = "idx_credit_tx_linked_ref", columnList = "linked_operation_ref")
})
@Check(constraints = "balance_before >= 0 AND balance_after >= 0 "
        + "AND balance_after = balance_before + amount")
public class CreditTransaction {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "tenant_id", nullable = false, updatable = false)
    @NotNull
    private Long tenantId;

    // Absent for operations initiated by an API key alone
    @Column(name = "actor_id", updatable = false)
    private Long actorId;

    @Enumerated(EnumType.STRING)
    @Column(name = "kind", length = 20, nullable = false, updatable = false)
    @NotNull
    private TransactionKind kind;

    @Column(name = "amount", nullable = false, updatable = false)
    private long amount;

    @Column(name = "balance_before", nullable = false, updatable = false)
    private long balanceBefore;

    @Column(name = "balance_after", nullable = false, updatable = false)
    private long balanceAfter;

    @Column(name = "linked_operation_ref", length = 255, updatable = false)
    private String linkedOperationRef;

    @Column(name = "description", columnDefinition = "TEXT", updatable = false)
    private String description;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    protected CreditTransaction() {
    }

    public CreditTransaction(Long tenantId, Long actorId, TransactionKind kind, long amount,
                             long balanceBefore, String linkedOperationRef, String description) {
        this.tenantId = tenantId;
        this.actorId = actorId;
        this.kind = kind;
        this.amount = amount;
        this.balanceBefore = balanceBefore;
        this.balanceAfter = balanceBefore + amount;
        this.linkedOperationRef = linkedOperationRef;
        this.description = description;
    }

    public Long getId() {
        return id;
    }

    public Long getTenantId() {
        return tenantId;
    }

    public Long getActorId() {
        return actorId;
    }

    public TransactionKind getKind() {
        return kind;
    }

    public long getAmount() {
        return amount;
    }

    public long getBalanceBefore() {
        return balanceBefore;
    }

    public long getBalanceAfter() {
        return balanceAfter;
    }

    public String getLinkedOperationRef() {
        return linkedOperationRef;
    }

    public String getDescription() {
        return description;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }
}
