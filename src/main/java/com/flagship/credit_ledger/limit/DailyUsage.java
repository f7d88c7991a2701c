package com.flagship.credit_ledger.limit;

import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * A user's spend for one UTC day. cap and remaining are null when the
 * user has no daily cap.
 */
@Value
public class DailyUsage {
    String userId;
    LocalDate day;
    BigDecimal spent;
    BigDecimal cap;
    BigDecimal remaining;

    public boolean isCapped() {
        return cap != null;
    }
}
