package com.flagship.credit_ledger.ledger;

import lombok.Value;

import java.math.BigDecimal;

/**
 * Ledger-versus-balance check for one user.
 *
 * Holds when the summed decreases recorded in the ledger equal the
 * opening balance minus the current balance.
 */
@Value
public class ReconciliationReport {
    String userId;
    long transactionCount;
    BigDecimal openingBalance;
    BigDecimal currentBalance;
    BigDecimal ledgerNetDecrease;

    public BigDecimal getBalanceDecrease() {
        return openingBalance.subtract(currentBalance);
    }

    public BigDecimal getDiscrepancy() {
        return getBalanceDecrease().subtract(ledgerNetDecrease);
    }

    public boolean isBalanced() {
        return getDiscrepancy().signum() == 0;
    }
}
