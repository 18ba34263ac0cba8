package com.creditgate.shared.model;

/**
 * Kind of balance change recorded in the credit ledger.
 * USAGE entries carry a negative (or zero, for free operations) amount,
 * every other kind carries a positive amount.
 */
public enum TransactionKind {
    PURCHASE,
    USAGE,
    REFUND,
    ADJUSTMENT,
    PROMO;

    public boolean isCredit() {
        return this != USAGE;
    }
}
