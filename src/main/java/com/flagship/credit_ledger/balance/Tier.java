package com.flagship.credit_ledger.balance;

/**
 * Subscription level. Stored lowercase in the users table.
 */
public enum Tier {
    BASIC,
    PRO,
    MAX,
    ADMIN;

    public String dbValue() {
        return name().toLowerCase();
    }

    public static Tier fromDbValue(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Tier is required");
        }
        return Tier.valueOf(value.trim().toUpperCase());
    }
}
