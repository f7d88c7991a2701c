package com.flagship.credit_ledger.exception;

/**
 * Tag carried by every ledger error, so callers can branch on the kind of
 * failure without matching on exception classes.
 */
public enum LedgerErrorKind {
    INSUFFICIENT_CREDITS,
    CONCURRENT_MODIFICATION,
    DAILY_LIMIT_EXCEEDED,
    TRIAL_EXPIRED,
    USER_NOT_FOUND,
    TRANSIENT_STORE_ERROR
}
