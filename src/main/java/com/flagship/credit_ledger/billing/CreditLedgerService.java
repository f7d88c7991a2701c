package com.flagship.credit_ledger.billing;

import com.flagship.credit_ledger.balance.BalanceStore;
import com.flagship.credit_ledger.balance.Tier;
import com.flagship.credit_ledger.balance.UserBalance;
import com.flagship.credit_ledger.cache.BalanceCache;
import com.flagship.credit_ledger.credit.CreditAmounts;
import com.flagship.credit_ledger.credit.CreditGrantService;
import com.flagship.credit_ledger.credit.DeductionEngine;
import com.flagship.credit_ledger.credit.DeductionResult;
import com.flagship.credit_ledger.exception.ConcurrentBalanceModificationException;
import com.flagship.credit_ledger.exception.InsufficientCreditsException;
import com.flagship.credit_ledger.exception.LedgerException;
import com.flagship.credit_ledger.exception.LedgerResult;
import com.flagship.credit_ledger.exception.UserNotFoundException;
import com.flagship.credit_ledger.incident.BillingIncidentService;
import com.flagship.credit_ledger.ledger.CreditTransaction;
import com.flagship.credit_ledger.ledger.ReconciliationReport;
import com.flagship.credit_ledger.ledger.TransactionLedger;
import com.flagship.credit_ledger.ledger.TransactionType;
import com.flagship.credit_ledger.lifecycle.LifecycleManager;
import com.flagship.credit_ledger.limit.DailyUsage;
import com.flagship.credit_ledger.limit.DailyUsageLimiter;
import com.flagship.credit_ledger.observability.LedgerMetrics;
import com.flagship.credit_ledger.resilience.TransientRetryExecutor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Entry point for everything that reads or moves credits.
 *
 * Charging a user for a resource goes through two calls:
 * 1. {@link #preCheck} before the resource is produced. Rejections here
 *    cost nothing.
 * 2. {@link #deduct} (or {@link #tryDeduct}) to charge, or
 *    {@link #settleDeliveredUsage} when the resource was already delivered
 *    and a failure can only be reconciled afterwards.
 *
 * Every call runs inside the transient-retry wrapper. Ledger errors are
 * never retried here; a {@link ConcurrentBalanceModificationException}
 * from {@link #deduct} is the caller's to retry.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CreditLedgerService {

    public static final String MDC_USER_ID = "userId";

    static final int MAX_SETTLEMENT_ATTEMPTS = 3;
    static final int DEFAULT_HISTORY_LIMIT = 50;
    static final int MAX_HISTORY_LIMIT = 500;

    private final BalanceStore balanceStore;
    private final BalanceCache balanceCache;
    private final DeductionEngine deductionEngine;
    private final CreditGrantService creditGrantService;
    private final DailyUsageLimiter dailyUsageLimiter;
    private final LifecycleManager lifecycleManager;
    private final TransactionLedger transactionLedger;
    private final TransientRetryExecutor retryExecutor;
    private final BillingIncidentService billingIncidentService;
    private final LedgerMetrics metrics;

    // ==================== Reads ====================

    /**
     * Cached balance snapshot. May be up to one cache TTL stale for changes
     * made by other instances.
     */
    public UserBalance getBalance(String userId) {
        return withUser(userId, () -> retryExecutor.execute("getBalance", () -> loadUser(userId)));
    }

    /**
     * Newest first. limit is clamped to 1..500.
     */
    public List<CreditTransaction> getTransactions(String userId, int limit) {
        int clamped = limit <= 0 ? DEFAULT_HISTORY_LIMIT : Math.min(limit, MAX_HISTORY_LIMIT);
        return withUser(userId, () -> retryExecutor.execute("getTransactions",
            () -> transactionLedger.findByUser(userId, clamped)));
    }

    public DailyUsage getDailyUsage(String userId) {
        return withUser(userId, () -> retryExecutor.execute("getDailyUsage",
            () -> dailyUsageLimiter.getDailyUsage(loadUser(userId))));
    }

    /**
     * Checks the ledger against the stored balance, read fresh from the store.
     */
    public ReconciliationReport reconcile(String userId) {
        return withUser(userId, () -> retryExecutor.execute("reconcile", () -> {
            UserBalance current = balanceStore.findById(userId)
                .orElseThrow(() -> new UserNotFoundException(userId));
            ReconciliationReport report = transactionLedger.reconcile(userId, current.getTotal());
            if (!report.isBalanced()) {
                log.error("{}: ledger does not reconcile for user {}: discrepancy={}",
                    BillingIncidentService.LOG_MARKER, userId, report.getDiscrepancy().toPlainString());
            }
            return report;
        }));
    }

    // ==================== Gates ====================

    public void enforceDailyLimit(String userId, BigDecimal amount) {
        withUser(userId, () -> retryExecutor.execute("enforceDailyLimit", () -> {
            dailyUsageLimiter.enforceDailyLimit(loadUser(userId), amount);
            return null;
        }));
    }

    /**
     * Runs every gate a deduction would run, without writing: trial expiry,
     * daily limit and sufficient balance. Uses the cached snapshot.
     *
     * @return the snapshot the checks ran against
     */
    public UserBalance preCheck(String userId, BigDecimal estimatedAmount) {
        CreditAmounts.requireNonNegative(estimatedAmount, "Estimated amount");
        return withUser(userId, () -> {
            try {
                return retryExecutor.execute("preCheck", () -> {
                    UserBalance user = loadUser(userId);
                    lifecycleManager.validateTrialExpiration(user);
                    dailyUsageLimiter.enforceDailyLimit(user, estimatedAmount);
                    if (!user.isAdmin() && user.getTotal().compareTo(estimatedAmount) < 0) {
                        throw new InsufficientCreditsException(estimatedAmount, user.getTotal());
                    }
                    return user;
                });
            } catch (LedgerException e) {
                log.warn("Pre-check rejected for user {}: {}", userId, e.getMessage());
                throw e;
            }
        });
    }

    // ==================== Charging ====================

    /**
     * Full pipeline: trial expiry, daily limit, then the conditional debit.
     *
     * @throws LedgerException of any kind except TRANSIENT_STORE_ERROR before
     *                         retries are exhausted
     */
    public DeductionResult deduct(String userId, BigDecimal amount, String description,
                                  Map<String, Object> metadata) {
        CreditAmounts.requireNonNegative(amount, "Deduction amount");
        return withUser(userId, () -> metrics.timeDeduction(() -> {
            try {
                return retryExecutor.execute("deduct", () -> {
                    UserBalance user = loadUser(userId);
                    lifecycleManager.validateTrialExpiration(user);
                    dailyUsageLimiter.enforceDailyLimit(user, amount);
                    return deductionEngine.deduct(userId, amount, description, metadata);
                });
            } catch (LedgerException e) {
                metrics.recordDeductionRejected(e.getKind());
                log.warn("Deduction of {} rejected for user {}: {}", amount.toPlainString(), userId, e.getMessage());
                throw e;
            }
        }));
    }

    /**
     * {@link #deduct} with the outcome as a tagged value instead of an
     * exception.
     */
    public LedgerResult<DeductionResult> tryDeduct(String userId, BigDecimal amount, String description,
                                                   Map<String, Object> metadata) {
        try {
            return LedgerResult.success(deduct(userId, amount, description, metadata));
        } catch (LedgerException e) {
            return LedgerResult.failure(e);
        }
    }

    /**
     * Charges for a resource that was already delivered.
     *
     * The trial and daily-limit gates are skipped: they ran in the pre-check
     * and the resource cannot be taken back. Lost races are retried a few
     * times. Any remaining failure is recorded as a billing incident and
     * returned as a failed result.
     */
    public LedgerResult<DeductionResult> settleDeliveredUsage(String userId, BigDecimal amount, String description,
                                                              Map<String, Object> metadata) {
        CreditAmounts.requireNonNegative(amount, "Settlement amount");
        return withUser(userId, () -> {
            try {
                return LedgerResult.success(settleWithRetries(userId, amount, description, metadata));
            } catch (LedgerException e) {
                recordIncident(userId, amount, description, metadata, e);
                return LedgerResult.failure(e);
            } catch (RuntimeException e) {
                recordIncident(userId, amount, description, metadata, e);
                throw e;
            }
        });
    }

    private DeductionResult settleWithRetries(String userId, BigDecimal amount, String description,
                                              Map<String, Object> metadata) {
        for (int attempt = 1; ; attempt++) {
            try {
                return retryExecutor.execute("settleDeliveredUsage",
                    () -> deductionEngine.deduct(userId, amount, description, metadata));
            } catch (ConcurrentBalanceModificationException e) {
                if (attempt >= MAX_SETTLEMENT_ATTEMPTS) {
                    throw e;
                }
                log.info("Settlement for user {} lost a race (attempt {}), re-reading", userId, attempt);
            }
        }
    }

    private void recordIncident(String userId, BigDecimal amount, String description,
                                Map<String, Object> metadata, RuntimeException error) {
        try {
            billingIncidentService.recordMissedDeduction(userId, amount, description, metadata, error);
        } catch (RuntimeException persistFailure) {
            log.error("{}: could not persist billing incident for user {}, amount={}",
                BillingIncidentService.LOG_MARKER, userId, amount.toPlainString(), persistFailure);
        }
    }

    // ==================== Credits and lifecycle ====================

    public CreditTransaction addCredits(String userId, BigDecimal amount, TransactionType type,
                                        String description, Map<String, Object> metadata) {
        return withUser(userId, () -> retryExecutor.execute("addCredits",
            () -> creditGrantService.addCredits(userId, amount, type, description, metadata)));
    }

    public CreditTransaction resetSubscriptionAllowance(String userId, BigDecimal newAllowance, Tier tier) {
        return withUser(userId, () -> retryExecutor.execute("resetSubscriptionAllowance",
            () -> lifecycleManager.resetSubscriptionAllowance(userId, newAllowance, tier)));
    }

    public Optional<CreditTransaction> forfeitSubscriptionAllowance(String userId) {
        return withUser(userId, () -> retryExecutor.execute("forfeitSubscriptionAllowance",
            () -> lifecycleManager.forfeitSubscriptionAllowance(userId)));
    }

    public UserBalance openAccount(String userId, String partnerCode) {
        return withUser(userId, () -> retryExecutor.execute("openAccount",
            () -> lifecycleManager.openAccount(userId, partnerCode)));
    }

    public void closeAccount(String userId) {
        withUser(userId, () -> {
            retryExecutor.run("closeAccount", () -> lifecycleManager.closeAccount(userId));
            return null;
        });
    }

    // ==================== Helpers ====================

    private UserBalance loadUser(String userId) {
        return balanceCache.get(userId, balanceStore::findById)
            .orElseThrow(() -> new UserNotFoundException(userId));
    }

    private <T> T withUser(String userId, Supplier<T> call) {
        String previous = MDC.get(MDC_USER_ID);
        MDC.put(MDC_USER_ID, userId);
        try {
            return call.get();
        } finally {
            if (previous != null) {
                MDC.put(MDC_USER_ID, previous);
            } else {
                MDC.remove(MDC_USER_ID);
            }
        }
    }
}
