package com.flagship.credit_ledger.ledger;

/**
 * Kind of balance-affecting event. Stored lowercase in the transactions table.
 */
public enum TransactionType {
    API_USAGE,
    ADMIN_CREDIT,
    PURCHASE,
    REFUND,
    ALLOWANCE_RESET,
    ALLOWANCE_FORFEIT;

    public String dbValue() {
        return name().toLowerCase();
    }

    public static TransactionType fromDbValue(String value) {
        return TransactionType.valueOf(value.trim().toUpperCase());
    }

    /**
     * Types accepted by a credit grant. Grants always land in purchased credits.
     */
    public boolean isCreditGrant() {
        return this == ADMIN_CREDIT || this == PURCHASE || this == REFUND;
    }
}
