package com.creditgate.ledger;

public class AccountNotFoundException extends RuntimeException {

    private final Long tenantId;

    public AccountNotFoundException(Long tenantId) {
        super("Credit account not found for tenant " + tenantId);
        this.tenantId = tenantId;
    }

    public Long getTenantId() {
        return tenantId;
    }
}
