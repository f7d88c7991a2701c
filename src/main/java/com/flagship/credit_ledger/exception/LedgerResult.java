package com.flagship.credit_ledger.exception;

import java.util.Objects;
import java.util.Optional;

/**
 * Tagged result of a ledger call: either a value or a {@link LedgerException}
 * with its {@link LedgerErrorKind}.
 *
 * Usage:
 * <pre>
 * LedgerResult&lt;DeductionResult&gt; result = creditLedgerService.tryDeduct(...);
 * if (result.isFailure() &amp;&amp; result.getErrorKind() == LedgerErrorKind.INSUFFICIENT_CREDITS) {
 *     // ask the user to top up
 * }
 * </pre>
 */
public final class LedgerResult<T> {

    private final T value;
    private final LedgerException error;

    private LedgerResult(T value, LedgerException error) {
        this.value = value;
        this.error = error;
    }

    public static <T> LedgerResult<T> success(T value) {
        return new LedgerResult<>(value, null);
    }

    public static <T> LedgerResult<T> failure(LedgerException error) {
        return new LedgerResult<>(null, Objects.requireNonNull(error, "error"));
    }

    public boolean isSuccess() {
        return error == null;
    }

    public boolean isFailure() {
        return error != null;
    }

    public T getValue() {
        if (error != null) {
            throw new IllegalStateException("No value on a failed result: " + error.getKind());
        }
        return value;
    }

    public Optional<LedgerException> getError() {
        return Optional.ofNullable(error);
    }

    /**
     * @return the error kind, or null for a successful result
     */
    public LedgerErrorKind getErrorKind() {
        return error != null ? error.getKind() : null;
    }

    /**
     * Unwraps the value, rethrowing the carried error on failure.
     */
    public T orElseThrow() {
        if (error != null) {
            throw error;
        }
        return value;
    }
}
