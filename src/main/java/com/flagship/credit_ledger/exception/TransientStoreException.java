package com.flagship.credit_ledger.exception;

/**
 * Surfaced once a transient store/network failure has exhausted its retry
 * attempts.
 */
public class TransientStoreException extends LedgerException {

    private final String operation;
    private final int attempts;

    public TransientStoreException(String operation, int attempts, Throwable cause) {
        super(LedgerErrorKind.TRANSIENT_STORE_ERROR,
            String.format("Store call '%s' failed after %d attempts: %s",
                operation, attempts, cause.getMessage()),
            cause);
        this.operation = operation;
        this.attempts = attempts;
    }

    public String getOperation() {
        return operation;
    }

    public int getAttempts() {
        return attempts;
    }
}
