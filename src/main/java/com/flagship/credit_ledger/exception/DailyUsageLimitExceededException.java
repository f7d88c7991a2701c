package com.flagship.credit_ledger.exception;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Today's (UTC) spend plus the requested amount would exceed the user's cap.
 */
public class DailyUsageLimitExceededException extends LedgerException {

    private final String userId;
    private final BigDecimal cap;
    private final BigDecimal spentToday;
    private final BigDecimal attempted;

    public DailyUsageLimitExceededException(String userId, BigDecimal cap,
                                            BigDecimal spentToday, BigDecimal attempted) {
        super(LedgerErrorKind.DAILY_LIMIT_EXCEEDED, String.format(
            "Daily usage limit of $%s exceeded: spent today ~$%s, attempted ~$%s",
            cap.setScale(2, RoundingMode.HALF_UP).toPlainString(),
            spentToday.setScale(2, RoundingMode.HALF_UP).toPlainString(),
            attempted.setScale(2, RoundingMode.HALF_UP).toPlainString()));
        this.userId = userId;
        this.cap = cap;
        this.spentToday = spentToday;
        this.attempted = attempted;
    }

    public String getUserId() {
        return userId;
    }

    public BigDecimal getCap() {
        return cap;
    }

    public BigDecimal getSpentToday() {
        return spentToday;
    }

    public BigDecimal getAttempted() {
        return attempted;
    }
}
