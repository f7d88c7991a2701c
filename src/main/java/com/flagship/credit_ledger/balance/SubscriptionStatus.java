package com.flagship.credit_ledger.balance;

/**
 * Subscription state of a user. Stored lowercase in the users table.
 */
public enum SubscriptionStatus {
    TRIAL,
    ACTIVE,
    CANCELLED,
    EXPIRED;

    public String dbValue() {
        return name().toLowerCase();
    }

    public static SubscriptionStatus fromDbValue(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Subscription status is required");
        }
        return SubscriptionStatus.valueOf(value.trim().toUpperCase());
    }
}
