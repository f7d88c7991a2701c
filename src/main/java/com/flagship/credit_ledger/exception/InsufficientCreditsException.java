package com.flagship.credit_ledger.exception;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Raised when the spendable total (allowance + purchased) is below the
 * requested debit. No write has happened when this is thrown.
 */
public class InsufficientCreditsException extends LedgerException {

    private final BigDecimal required;
    private final BigDecimal available;

    public InsufficientCreditsException(BigDecimal required, BigDecimal available) {
        // Message carries cents only; exact balances stay in the fields.
        super(LedgerErrorKind.INSUFFICIENT_CREDITS, String.format(
            "Insufficient credits. Current balance: ~$%s, Required: ~$%s. Please add credits to continue.",
            available.setScale(2, RoundingMode.HALF_UP).toPlainString(),
            required.setScale(2, RoundingMode.HALF_UP).toPlainString()));
        this.required = required;
        this.available = available;
    }

    public BigDecimal getRequired() {
        return required;
    }

    public BigDecimal getAvailable() {
        return available;
    }
}
