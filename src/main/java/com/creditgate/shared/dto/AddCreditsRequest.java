package com.creditgate.shared.dto;

import com.creditgate.shared.model.TransactionKind;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;

/**
 * DTO for crediting a tenant after an external payment or an admin adjustment.
 */
public class AddCreditsRequest {

    @NotNull(message = "tenantId is required")
    private Long tenantId;

    @NotNull(message = "amount is required")
    @Positive(message = "amount must be positive")
    private Long amount;

    private TransactionKind kind = TransactionKind.PURCHASE;

    @Size(max = 255, message = "reference must not exceed 255 characters")
    private String reference;

    @Size(max = 500, message = "description must not exceed 500 characters")
    private String description;

    public AddCreditsRequest() {
    }

    public Long getTenantId() {
        return tenantId;
    }

    public void setTenantId(Long tenantId) {
        this.tenantId = tenantId;
    }

    public Long getAmount() {
        return amount;
    }

    public void setAmount(Long amount) {
        this.amount = amount;
    }

    public TransactionKind getKind() {
        return kind;
    }

    public void setKind(TransactionKind kind) {
        this.kind = kind != null ? kind : TransactionKind.PURCHASE;
    }

    public String getReference() {
        return reference;
    }

    public void setReference(String reference) {
        this.reference = reference;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }
}
