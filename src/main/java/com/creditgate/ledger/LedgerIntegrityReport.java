package com.creditgate.ledger;

/**
 * Result of reconciling a tenant's account row against its transaction log.
 */
public class LedgerIntegrityReport {

    private final Long tenantId;
    private final long balance;
    private final long sumOfAmounts;
    private final long transactionCount;
    private final boolean totalsConsistent;
    private final boolean chainContinuous;
    private final Long firstBrokenTransactionId;

    public LedgerIntegrityReport(Long tenantId, long balance, long sumOfAmounts, long transactionCount,
                                 boolean totalsConsistent, boolean chainContinuous,
                                 Long firstBrokenTransactionId) {
        this.tenantId = tenantId;
        this.balance = balance;
        this.sumOfAmounts = sumOfAmounts;
        this.transactionCount = transactionCount;
        this.totalsConsistent = totalsConsistent;
        this.chainContinuous = chainContinuous;
        this.firstBrokenTransactionId = firstBrokenTransactionId;
    }

    public boolean isConsistent() {
        return totalsConsistent && chainContinuous && sumOfAmounts == balance;
    }

    public Long getTenantId() {
        return tenantId;
    }

    public long getBalance() {
        return balance;
    }

    public long getSumOfAmounts() {
        return sumOfAmounts;
    }

    public long getTransactionCount() {
        return transactionCount;
    }

    public boolean isTotalsConsistent() {
        return totalsConsistent;
    }

    public boolean isChainContinuous() {
        return chainContinuous;
    }

    public Long getFirstBrokenTransactionId() {
        return firstBrokenTransactionId;
    }
}
