package com.creditgate.shared.dto;

import com.creditgate.shared.model.CreditTransaction;
import com.creditgate.shared.model.TransactionKind;

import java.time.Instant;

/**
 * DTO for one ledger entry.
 */
public class TransactionResponse {

    private Long id;
    private TransactionKind kind;
    private long amount;
    private long balanceBefore;
    private long balanceAfter;
    private String linkedOperationRef;
    private String description;
    private Instant createdAt;

    public TransactionResponse() {
    }

    public static TransactionResponse from(CreditTransaction transaction) {
        TransactionResponse response = new TransactionResponse();
        response.id = transaction.getId();
        response.kind = transaction.getKind();
        response.amount = transaction.getAmount();
        response.balanceBefore = transaction.getBalanceBefore();
        response.balanceAfter = transaction.getBalanceAfter();
        response.linkedOperationRef = transaction.getLinkedOperationRef();
        response.description = transaction.getDescription();
        response.createdAt = transaction.getCreatedAt();
        return response;
    }

    public Long getId() {
        return id;
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
