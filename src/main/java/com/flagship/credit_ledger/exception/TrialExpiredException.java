package com.flagship.credit_ledger.exception;

import java.time.Instant;

/**
 * Payment-required class error: the user's trial period is over.
 */
public class TrialExpiredException extends LedgerException {

    private final String userId;
    private final Instant expiredAt;

    public TrialExpiredException(String userId, Instant expiredAt) {
        super(LedgerErrorKind.TRIAL_EXPIRED,
            "Trial for user " + userId + " expired at " + expiredAt + ". A subscription or credit purchase is required.");
        this.userId = userId;
        this.expiredAt = expiredAt;
    }

    public String getUserId() {
        return userId;
    }

    public Instant getExpiredAt() {
        return expiredAt;
    }
}
