package com.flagship.credit_ledger.credit;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Dollar amounts as stored: NUMERIC(19, 6).
 */
public final class CreditAmounts {

    public static final int SCALE = 6;

    /** Debits below one millionth of a dollar are not charged. */
    public static final BigDecimal EPSILON = new BigDecimal("0.000001");

    private CreditAmounts() {
    }

    public static BigDecimal normalize(BigDecimal amount) {
        return amount.setScale(SCALE, RoundingMode.HALF_UP);
    }

    public static boolean isNegligible(BigDecimal amount) {
        return amount.compareTo(EPSILON) < 0;
    }

    public static BigDecimal requireNonNegative(BigDecimal amount, String name) {
        if (amount == null) {
            throw new IllegalArgumentException(name + " is required");
        }
        if (amount.signum() < 0) {
            throw new IllegalArgumentException(name + " cannot be negative");
        }
        return amount;
    }

    public static BigDecimal requirePositive(BigDecimal amount, String name) {
        if (amount == null) {
            throw new IllegalArgumentException(name + " is required");
        }
        if (amount.signum() <= 0) {
            throw new IllegalArgumentException(name + " must be positive");
        }
        return amount;
    }
}
