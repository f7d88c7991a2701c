package com.flagship.credit_ledger.credit;

import com.flagship.credit_ledger.balance.BalanceStore;
import com.flagship.credit_ledger.balance.UserBalance;
import com.flagship.credit_ledger.cache.BalanceCacheInvalidator;
import com.flagship.credit_ledger.event.LedgerEventRecorder;
import com.flagship.credit_ledger.exception.ConcurrentBalanceModificationException;
import com.flagship.credit_ledger.exception.InsufficientCreditsException;
import com.flagship.credit_ledger.exception.UserNotFoundException;
import com.flagship.credit_ledger.ledger.CreditTransaction;
import com.flagship.credit_ledger.ledger.TransactionLedger;
import com.flagship.credit_ledger.ledger.TransactionType;
import com.flagship.credit_ledger.observability.LedgerMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Debits a user's balance with optimistic concurrency.
 *
 * One call is one database transaction:
 * 1. Read a fresh snapshot of both balances (never the cache)
 * 2. Check sufficiency and split the amount with {@link AllocationPolicy}
 * 3. Conditionally write both balances against the snapshot values
 * 4. Record the api_usage transaction and its outbox events
 *
 * If another writer changed the row between 1 and 3, the conditional
 * write matches nothing and {@link ConcurrentBalanceModificationException}
 * is thrown. The engine never retries: the caller decides whether to
 * re-read and try again. Nothing is persisted on any failure.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DeductionEngine {

    private final BalanceStore balanceStore;
    private final TransactionLedger transactionLedger;
    private final LedgerEventRecorder eventRecorder;
    private final BalanceCacheInvalidator cacheInvalidator;
    private final LedgerMetrics metrics;
    private final Clock clock;

    /**
     * @param userId      User to charge
     * @param amount      Dollars to deduct, must not be negative
     * @param description Stored on the transaction row
     * @param metadata    Caller metadata (model, tokens, request id...), merged
     *                    with the split details
     * @return CHARGED with the recorded transaction, or a SKIPPED status when
     *         nothing was written
     * @throws InsufficientCreditsException           if allowance + purchased < amount
     * @throws ConcurrentBalanceModificationException if the snapshot went stale
     * @throws UserNotFoundException                  if the user does not exist
     */
    @Transactional
    public DeductionResult deduct(String userId, BigDecimal amount, String description,
                                  Map<String, Object> metadata) {
        CreditAmounts.requireNonNegative(amount, "Deduction amount");

        if (CreditAmounts.isNegligible(amount)) {
            log.debug("Skipping negligible deduction of {} for user {}", amount.toPlainString(), userId);
            DeductionResult skipped = DeductionResult.skippedNegligible(userId, amount);
            metrics.recordDeduction(skipped);
            return skipped;
        }

        BigDecimal charge = CreditAmounts.normalize(amount);
        UserBalance snapshot = balanceStore.findById(userId)
            .orElseThrow(() -> new UserNotFoundException(userId));

        if (snapshot.isAdmin()) {
            log.debug("Skipping deduction of {} for admin user {}", charge.toPlainString(), userId);
            DeductionResult skipped = DeductionResult.skippedAdmin(userId, charge);
            metrics.recordDeduction(skipped);
            return skipped;
        }

        BigDecimal allowance = snapshot.getSubscriptionAllowance();
        BigDecimal purchased = snapshot.getPurchasedCredits();
        BigDecimal total = snapshot.getTotal();
        if (total.compareTo(charge) < 0) {
            throw new InsufficientCreditsException(charge, total);
        }

        Allocation allocation = AllocationPolicy.split(allowance, purchased, charge);
        BigDecimal newAllowance = allowance.subtract(allocation.getFromAllowance());
        BigDecimal newPurchased = purchased.subtract(allocation.getFromPurchased());

        boolean written = balanceStore.compareAndSetBalances(userId, allowance, purchased, newAllowance, newPurchased);
        if (!written) {
            metrics.recordCasConflict();
            log.warn("Balance for user {} changed since it was read (allowance={}, purchased={}), deduction of {} rejected",
                userId, allowance, purchased, charge.toPlainString());
            throw new ConcurrentBalanceModificationException(userId);
        }

        Map<String, Object> details = new LinkedHashMap<>(metadata != null ? metadata : Map.of());
        details.put(CreditTransaction.FROM_ALLOWANCE, allocation.getFromAllowance());
        details.put(CreditTransaction.FROM_PURCHASED, allocation.getFromPurchased());
        details.put(CreditTransaction.ALLOWANCE_BEFORE, allowance);
        details.put(CreditTransaction.ALLOWANCE_AFTER, newAllowance);
        details.put(CreditTransaction.PURCHASED_BEFORE, purchased);
        details.put(CreditTransaction.PURCHASED_AFTER, newPurchased);

        CreditTransaction transaction = transactionLedger.record(CreditTransaction.create(
            userId,
            TransactionType.API_USAGE,
            description,
            total,
            newAllowance.add(newPurchased),
            details,
            clock.instant()
        ));
        eventRecorder.recordBalanceChange(transaction);
        cacheInvalidator.invalidateAfterCommit(userId);

        DeductionResult result = DeductionResult.charged(transaction, allocation);
        metrics.recordDeduction(result);
        log.info("Deducted {} from user {}: fromAllowance={}, fromPurchased={}, balance {} -> {}",
            charge.toPlainString(), userId,
            allocation.getFromAllowance().toPlainString(), allocation.getFromPurchased().toPlainString(),
            transaction.getBalanceBefore().toPlainString(), transaction.getBalanceAfter().toPlainString());
        return result;
    }
}
