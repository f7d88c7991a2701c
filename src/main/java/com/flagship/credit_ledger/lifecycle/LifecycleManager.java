package com.flagship.credit_ledger.lifecycle;

import com.flagship.credit_ledger.balance.BalanceStore;
import com.flagship.credit_ledger.balance.SubscriptionStatus;
import com.flagship.credit_ledger.balance.Tier;
import com.flagship.credit_ledger.balance.UserBalance;
import com.flagship.credit_ledger.cache.BalanceCacheInvalidator;
import com.flagship.credit_ledger.config.LedgerProperties;
import com.flagship.credit_ledger.credit.CreditAmounts;
import com.flagship.credit_ledger.event.LedgerEventRecorder;
import com.flagship.credit_ledger.exception.ConcurrentBalanceModificationException;
import com.flagship.credit_ledger.exception.TrialExpiredException;
import com.flagship.credit_ledger.exception.UserNotFoundException;
import com.flagship.credit_ledger.ledger.CreditTransaction;
import com.flagship.credit_ledger.ledger.TransactionLedger;
import com.flagship.credit_ledger.ledger.TransactionType;
import com.flagship.credit_ledger.observability.LedgerMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Subscription allowance lifecycle: renewal, cancellation, trial expiry,
 * account open and close.
 *
 * Allowance never rolls over. Renewal overwrites it and cancellation
 * zeroes it; both record the unused amount as forfeited_allowance.
 * Purchased credits are never touched here.
 *
 * Renewal and cancellation write conditionally on the allowance that was
 * read, like deductions. A concurrent debit makes them fail with
 * {@link ConcurrentBalanceModificationException}; the caller re-reads and
 * retries.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LifecycleManager {

    static final String REASON = "reason";
    static final String TRIAL_START = "trial_start";
    static final String TIER = "tier";

    private final BalanceStore balanceStore;
    private final TransactionLedger transactionLedger;
    private final LedgerEventRecorder eventRecorder;
    private final BalanceCacheInvalidator cacheInvalidator;
    private final LedgerProperties properties;
    private final LedgerMetrics metrics;
    private final Clock clock;

    /**
     * Renewal: replaces the allowance with newAllowance and stores the tier.
     */
    @Transactional
    public CreditTransaction resetSubscriptionAllowance(String userId, BigDecimal newAllowance, Tier tier) {
        CreditAmounts.requireNonNegative(newAllowance, "New allowance");
        if (tier == null) {
            throw new IllegalArgumentException("Tier is required");
        }

        BigDecimal allowance = CreditAmounts.normalize(newAllowance);
        UserBalance snapshot = balanceStore.findById(userId)
            .orElseThrow(() -> new UserNotFoundException(userId));
        BigDecimal forfeited = snapshot.getSubscriptionAllowance();

        if (!balanceStore.compareAndResetAllowance(userId, forfeited, allowance, tier)) {
            metrics.recordCasConflict();
            throw new ConcurrentBalanceModificationException(userId);
        }

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put(CreditTransaction.FORFEITED_ALLOWANCE, forfeited);
        metadata.put(CreditTransaction.NEW_ALLOWANCE, allowance);
        metadata.put(TIER, tier.dbValue());

        CreditTransaction transaction = record(snapshot, TransactionType.ALLOWANCE_RESET,
            "Subscription renewal (" + tier.dbValue() + ")",
            allowance.add(snapshot.getPurchasedCredits()), metadata);

        log.info("Reset allowance for user {}: forfeited={}, newAllowance={}, tier={}, purchased={}",
            userId, forfeited.toPlainString(), allowance.toPlainString(), tier.dbValue(),
            snapshot.getPurchasedCredits().toPlainString());
        return transaction;
    }

    /**
     * Cancellation: zeroes the allowance.
     *
     * @return the forfeit transaction, or empty if the allowance was already
     *         zero and nothing was written
     */
    @Transactional
    public Optional<CreditTransaction> forfeitSubscriptionAllowance(String userId) {
        UserBalance snapshot = balanceStore.findById(userId)
            .orElseThrow(() -> new UserNotFoundException(userId));
        BigDecimal forfeited = snapshot.getSubscriptionAllowance();

        if (forfeited.signum() == 0) {
            log.info("No allowance to forfeit for user {}", userId);
            return Optional.empty();
        }

        if (!balanceStore.compareAndForfeitAllowance(userId, forfeited)) {
            metrics.recordCasConflict();
            throw new ConcurrentBalanceModificationException(userId);
        }

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put(CreditTransaction.FORFEITED_ALLOWANCE, forfeited);
        metadata.put(CreditTransaction.RETAINED_PURCHASED_CREDITS, snapshot.getPurchasedCredits());

        CreditTransaction transaction = record(snapshot, TransactionType.ALLOWANCE_FORFEIT,
            "Subscription cancelled", snapshot.getPurchasedCredits(), metadata);

        log.info("Forfeited allowance for user {}: forfeited={}, retainedPurchased={}",
            userId, forfeited.toPlainString(), snapshot.getPurchasedCredits().toPlainString());
        return Optional.of(transaction);
    }

    /**
     * @throws TrialExpiredException if the user is on trial and the trial is over
     */
    public void validateTrialExpiration(UserBalance user) {
        if (!user.isOnTrial()) {
            return;
        }
        String stored = user.getTrialExpiresAt();
        if (stored == null || stored.isBlank()) {
            return;
        }

        Instant expiresAt;
        try {
            expiresAt = TrialExpiryParser.parse(stored);
        } catch (DateTimeParseException e) {
            // Fails open: an unreadable timestamp must not lock the user out
            log.warn("Unparseable trial_expires_at '{}' for user {}, allowing request: {}",
                stored, user.getUserId(), e.getMessage());
            return;
        }

        if (clock.instant().isAfter(expiresAt)) {
            throw new TrialExpiredException(user.getUserId(), expiresAt);
        }
    }

    /**
     * Creates a trial account and records the trial allowance grant, so the
     * ledger opens from zero.
     *
     * @param partnerCode Optional partner that referred the user; selects a
     *                    partner daily cap when one is configured
     */
    @Transactional
    public UserBalance openAccount(String userId, String partnerCode) {
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("User id is required");
        }

        LedgerProperties.Trial trial = properties.getTrial();
        BigDecimal allowance = CreditAmounts.normalize(trial.getAllowance());
        Instant expiresAt = clock.instant().plus(trial.getDuration());

        UserBalance opened = UserBalance.builder()
            .userId(userId)
            .subscriptionAllowance(allowance)
            .purchasedCredits(CreditAmounts.normalize(BigDecimal.ZERO))
            .tier(Tier.BASIC)
            .subscriptionStatus(SubscriptionStatus.TRIAL)
            .trialExpiresAt(expiresAt.toString())
            .partnerCode(partnerCode != null && !partnerCode.isBlank() ? partnerCode.trim() : null)
            .build();

        try {
            balanceStore.insert(opened);
        } catch (DuplicateKeyException e) {
            throw new IllegalStateException("User " + userId + " already exists", e);
        }

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put(CreditTransaction.FORFEITED_ALLOWANCE, BigDecimal.ZERO);
        metadata.put(CreditTransaction.NEW_ALLOWANCE, allowance);
        metadata.put(REASON, TRIAL_START);

        CreditTransaction transaction = transactionLedger.record(CreditTransaction.create(
            userId, TransactionType.ALLOWANCE_RESET, "Trial started",
            BigDecimal.ZERO, allowance, metadata, clock.instant()));
        eventRecorder.recordBalanceChange(transaction);
        metrics.recordAllowanceChange(TransactionType.ALLOWANCE_RESET);

        log.info("Opened trial account for user {}: allowance={}, trialExpiresAt={}, partner={}",
            userId, allowance.toPlainString(), expiresAt, opened.getPartnerCode());
        return opened;
    }

    /**
     * Soft delete. The user is not found by any operation afterwards.
     */
    @Transactional
    public void closeAccount(String userId) {
        if (!balanceStore.softDelete(userId)) {
            throw new UserNotFoundException(userId);
        }
        cacheInvalidator.invalidateAfterCommit(userId);
        log.info("Closed account for user {}", userId);
    }

    private CreditTransaction record(UserBalance snapshot, TransactionType type, String description,
                                     BigDecimal balanceAfter, Map<String, Object> metadata) {
        CreditTransaction transaction = transactionLedger.record(CreditTransaction.create(
            snapshot.getUserId(), type, description, snapshot.getTotal(), balanceAfter,
            metadata, clock.instant()));
        eventRecorder.recordBalanceChange(transaction);
        cacheInvalidator.invalidateAfterCommit(snapshot.getUserId());
        metrics.recordAllowanceChange(type);
        return transaction;
    }
}
