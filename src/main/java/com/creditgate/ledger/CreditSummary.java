package com.creditgate.ledger;

import com.creditgate.shared.model.CreditTransaction;

import java.time.Instant;
import java.util.List;

/**
 * Dashboard view of a tenant's credits.
 */
public class CreditSummary {

    private final long balance;
    private final long totalPurchased;
    private final long totalUsed;
    private final Instant lastPurchaseAt;
    private final boolean needsLowBalanceAlert;
    private final List<CreditTransaction> recentTransactions;

    public CreditSummary(long balance, long totalPurchased, long totalUsed, Instant lastPurchaseAt,
                         boolean needsLowBalanceAlert, List<CreditTransaction> recentTransactions) {
        this.balance = balance;
        this.totalPurchased = totalPurchased;
        this.totalUsed = totalUsed;
        this.lastPurchaseAt = lastPurchaseAt;
        this.needsLowBalanceAlert = needsLowBalanceAlert;
        this.recentTransactions = recentTransactions;
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

    public List<CreditTransaction> getRecentTransactions() {
        return recentTransactions;
    }
}
