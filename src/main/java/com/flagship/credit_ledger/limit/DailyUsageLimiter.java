package com.flagship.credit_ledger.limit;

import com.flagship.credit_ledger.balance.BalanceStore;
import com.flagship.credit_ledger.balance.UserBalance;
import com.flagship.credit_ledger.credit.CreditAmounts;
import com.flagship.credit_ledger.exception.DailyUsageLimitExceededException;
import com.flagship.credit_ledger.exception.UserNotFoundException;
import com.flagship.credit_ledger.ledger.TransactionLedger;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Optional;

/**
 * Caps spend per UTC calendar day, independently of the balance.
 *
 * Today's spend is summed from today's api_usage transactions, so it
 * rolls over at midnight UTC with no reset job.
 *
 * The check is not atomic with the debit that follows it: concurrent
 * requests can each pass the check and together overshoot the cap by up
 * to one request's worth each.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DailyUsageLimiter {

    private final DailyLimitPolicy limitPolicy;
    private final TransactionLedger transactionLedger;
    private final BalanceStore balanceStore;
    private final Clock clock;

    public void enforceDailyLimit(String userId, BigDecimal amount) {
        UserBalance user = balanceStore.findById(userId)
            .orElseThrow(() -> new UserNotFoundException(userId));
        enforceDailyLimit(user, amount);
    }

    /**
     * @throws DailyUsageLimitExceededException if spent today + amount > cap
     */
    public void enforceDailyLimit(UserBalance user, BigDecimal amount) {
        CreditAmounts.requireNonNegative(amount, "Amount");

        Optional<BigDecimal> cap = limitPolicy.resolveCap(user);
        if (cap.isEmpty()) {
            return;
        }

        BigDecimal spentToday = spentOn(user.getUserId(), today());
        if (spentToday.add(amount).compareTo(cap.get()) > 0) {
            log.warn("Daily limit reached for user {}: cap={}, spentToday={}, attempted={}",
                user.getUserId(), cap.get(), spentToday.toPlainString(), amount.toPlainString());
            throw new DailyUsageLimitExceededException(user.getUserId(), cap.get(), spentToday, amount);
        }
    }

    public DailyUsage getDailyUsage(UserBalance user) {
        LocalDate day = today();
        BigDecimal spent = spentOn(user.getUserId(), day);
        Optional<BigDecimal> cap = limitPolicy.resolveCap(user);

        BigDecimal remaining = cap
            .map(c -> c.subtract(spent).max(BigDecimal.ZERO))
            .orElse(null);
        return new DailyUsage(user.getUserId(), day, spent, cap.orElse(null), remaining);
    }

    private BigDecimal spentOn(String userId, LocalDate day) {
        Instant from = day.atStartOfDay(ZoneOffset.UTC).toInstant();
        Instant to = day.plusDays(1).atStartOfDay(ZoneOffset.UTC).toInstant();
        return transactionLedger.sumUsageBetween(userId, from, to);
    }

    private LocalDate today() {
        return LocalDate.ofInstant(clock.instant(), ZoneOffset.UTC);
    }
}
