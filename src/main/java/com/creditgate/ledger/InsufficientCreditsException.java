package com.creditgate.ledger;

/**
 * Thrown when a tenant's balance cannot cover a charge.
 * Raised inside the ledger transaction, so nothing is written.
 */
public class InsufficientCreditsException extends RuntimeException {

    private final Long tenantId;
    private final long required;
    private final long balance;

    public InsufficientCreditsException(Long tenantId, long required, long balance) {
        super(String.format("Insufficient credits: required=%d, balance=%d", required, balance));
        this.tenantId = tenantId;
        this.required = required;
        this.balance = balance;
    }

    public Long getTenantId() {
        return tenantId;
    }

    public long getRequired() {
        return required;
    }

    public long getBalance() {
        return balance;
    }
}
