package com.flagship.credit_ledger.incident;

public enum BillingIncidentStatus {
    PENDING,
    RESOLVED;

    public String dbValue() {
        return name().toLowerCase();
    }
}
