package com.flagship.credit_ledger.credit;

import com.flagship.credit_ledger.balance.BalanceStore;
import com.flagship.credit_ledger.balance.UserBalance;
import com.flagship.credit_ledger.cache.BalanceCacheInvalidator;
import com.flagship.credit_ledger.event.LedgerEventRecorder;
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
 * Adds purchased credits: purchases, admin grants and refunds.
 *
 * The increment is a single atomic UPDATE, so grants never conflict with
 * each other. A deduction racing with a grant fails its conditional write
 * and the caller retries against the new balance.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CreditGrantService {

    private final BalanceStore balanceStore;
    private final TransactionLedger transactionLedger;
    private final LedgerEventRecorder eventRecorder;
    private final BalanceCacheInvalidator cacheInvalidator;
    private final LedgerMetrics metrics;
    private final Clock clock;

    /**
     * @param type purchase, admin_credit or refund
     * @throws IllegalArgumentException if the amount is not positive or the
     *                                  type does not add credits
     * @throws UserNotFoundException    if the user does not exist
     */
    @Transactional
    public CreditTransaction addCredits(String userId, BigDecimal amount, TransactionType type,
                                        String description, Map<String, Object> metadata) {
        CreditAmounts.requirePositive(amount, "Credit amount");
        if (type == null || !type.isCreditGrant()) {
            throw new IllegalArgumentException("Not a credit grant type: " + type);
        }

        BigDecimal credit = CreditAmounts.normalize(amount);
        if (credit.signum() == 0) {
            throw new IllegalArgumentException("Credit amount rounds to zero: " + amount.toPlainString());
        }

        UserBalance after = balanceStore.incrementPurchasedCredits(userId, credit)
            .orElseThrow(() -> new UserNotFoundException(userId));
        BigDecimal purchasedBefore = after.getPurchasedCredits().subtract(credit);

        Map<String, Object> details = new LinkedHashMap<>(metadata != null ? metadata : Map.of());
        details.put(CreditTransaction.ALLOWANCE_BEFORE, after.getSubscriptionAllowance());
        details.put(CreditTransaction.ALLOWANCE_AFTER, after.getSubscriptionAllowance());
        details.put(CreditTransaction.PURCHASED_BEFORE, purchasedBefore);
        details.put(CreditTransaction.PURCHASED_AFTER, after.getPurchasedCredits());

        CreditTransaction transaction = transactionLedger.record(CreditTransaction.create(
            userId,
            type,
            description,
            after.getTotal().subtract(credit),
            after.getTotal(),
            details,
            clock.instant()
        ));
        eventRecorder.recordBalanceChange(transaction);
        cacheInvalidator.invalidateAfterCommit(userId);
        metrics.recordCreditsAdded(type);

        log.info("Added {} credits ({}) to user {}: purchased {} -> {}",
            credit.toPlainString(), type.dbValue(), userId,
            purchasedBefore.toPlainString(), after.getPurchasedCredits().toPlainString());
        return transaction;
    }
}
