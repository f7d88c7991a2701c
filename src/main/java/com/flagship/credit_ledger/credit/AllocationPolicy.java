package com.flagship.credit_ledger.credit;

import java.math.BigDecimal;

/**
 * Tiered allocation: a debit drains the subscription allowance first and
 * only the remainder comes out of purchased credits.
 *
 * Pure function, no I/O. The caller checks sufficiency first; an
 * insufficient total here is a programming error.
 */
public final class AllocationPolicy {

    private AllocationPolicy() {
    }

    /**
     * @param allowance Current subscription allowance (>= 0)
     * @param purchased Current purchased credits (>= 0)
     * @param amount    Debit amount (> 0, at most allowance + purchased)
     * @return fromAllowance = min(allowance, amount), fromPurchased = amount - fromAllowance
     */
    public static Allocation split(BigDecimal allowance, BigDecimal purchased, BigDecimal amount) {
        CreditAmounts.requireNonNegative(allowance, "Allowance");
        CreditAmounts.requireNonNegative(purchased, "Purchased credits");
        CreditAmounts.requirePositive(amount, "Amount");
        if (allowance.add(purchased).compareTo(amount) < 0) {
            throw new IllegalArgumentException(String.format(
                "Cannot split %s across allowance=%s and purchased=%s", amount, allowance, purchased));
        }

        BigDecimal fromAllowance = allowance.min(amount);
        BigDecimal fromPurchased = amount.subtract(fromAllowance);
        return new Allocation(fromAllowance, fromPurchased);
    }
}
