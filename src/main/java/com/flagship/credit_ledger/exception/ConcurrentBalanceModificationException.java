package com.flagship.credit_ledger.exception;

/**
 * The conditional balance write matched zero rows: another writer committed
 * between our read and our write. The engine never retries this itself;
 * the caller re-reads and re-attempts the whole operation.
 */
public class ConcurrentBalanceModificationException extends LedgerException {

    private final String userId;

    public ConcurrentBalanceModificationException(String userId) {
        super(LedgerErrorKind.CONCURRENT_MODIFICATION,
            "Balance for user " + userId + " changed concurrently. Please retry.");
        this.userId = userId;
    }

    public String getUserId() {
        return userId;
    }
}
