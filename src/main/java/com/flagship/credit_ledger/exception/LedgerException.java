package com.flagship.credit_ledger.exception;

/**
 * Base class for all ledger errors.
 *
 * Only {@link LedgerErrorKind#TRANSIENT_STORE_ERROR} is retryable. Every
 * other kind is a legitimate business outcome and must reach the caller
 * unchanged.
 */
public abstract class LedgerException extends RuntimeException {

    private final LedgerErrorKind kind;

    protected LedgerException(LedgerErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    protected LedgerException(LedgerErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public LedgerErrorKind getKind() {
        return kind;
    }

    public boolean isRetryable() {
        return kind == LedgerErrorKind.TRANSIENT_STORE_ERROR;
    }
}
