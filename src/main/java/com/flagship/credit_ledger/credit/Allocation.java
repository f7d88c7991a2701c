package com.flagship.credit_ledger.credit;

import lombok.Value;

import java.math.BigDecimal;

/**
 * How a debit splits across the two balance pools.
 */
@Value
public class Allocation {
    BigDecimal fromAllowance;
    BigDecimal fromPurchased;

    public BigDecimal getTotal() {
        return fromAllowance.add(fromPurchased);
    }
}
