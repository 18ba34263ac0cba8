package com.creditgate.shared.dto;

import com.creditgate.ledger.CreditSummary;

import java.time.Instant;

/**
 * DTO for a tenant's credit balance.
 */
public class BalanceResponse {

    private Long tenantId;
    private long balance;
    private long totalPurchased;
    private long totalUsed;
    private Instant lastPurchaseAt;
    private boolean needsLowBalanceAlert;

    public BalanceResponse() {
    }

    public static BalanceResponse from(Long tenantId, CreditSummary summary) {
        BalanceResponse response = new BalanceResponse();
        response.tenantId = tenantId;
        response.balance = summary.getBalance();
        response.totalPurchased = summary.getTotalPurchased();
        response.totalUsed = summary.getTotalUsed();
        response.lastPurchaseAt = summary.getLastPurchaseAt();
        response.needsLowBalanceAlert = summary.isNeedsLowBalanceAlert();
        return response;
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

    public boolean isNeedsLowBalanceAlert() {
        return needsLowBalanceAlert;
    }
}
