package com.flagship.credit_ledger.credit;

import com.flagship.credit_ledger.ledger.CreditTransaction;
import lombok.Value;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * Outcome of a successful deduct call.
 *
 * Skipped outcomes wrote nothing: callers must not expect a transaction for
 * sub-epsilon amounts or admin users.
 */
@Value
public class DeductionResult {

    public enum Status {
        CHARGED,
        SKIPPED_NEGLIGIBLE,
        SKIPPED_ADMIN
    }

    Status status;
    String userId;
    BigDecimal amount;
    Allocation allocation;
    CreditTransaction transaction;

    public static DeductionResult charged(CreditTransaction transaction, Allocation allocation) {
        return new DeductionResult(Status.CHARGED, transaction.getUserId(),
            transaction.getAmount().negate(), allocation, transaction);
    }

    public static DeductionResult skippedNegligible(String userId, BigDecimal amount) {
        return new DeductionResult(Status.SKIPPED_NEGLIGIBLE, userId, amount, null, null);
    }

    public static DeductionResult skippedAdmin(String userId, BigDecimal amount) {
        return new DeductionResult(Status.SKIPPED_ADMIN, userId, amount, null, null);
    }

    public boolean isCharged() {
        return status == Status.CHARGED;
    }

    public Optional<CreditTransaction> findTransaction() {
        return Optional.ofNullable(transaction);
    }
}
