package com.flagship.credit_ledger.limit;

import com.flagship.credit_ledger.balance.UserBalance;
import com.flagship.credit_ledger.config.LedgerProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.Map;
import java.util.Optional;

/**
 * Resolves a user's daily spend cap. Empty means unlimited.
 *
 * Resolution order:
 * 1. admin tier: unlimited
 * 2. active paid subscription: unlimited
 * 3. partner code with a configured cap (case-insensitive): that cap
 * 4. everyone else (trial, cancelled, expired): the default cap
 */
@Component
@RequiredArgsConstructor
public class DailyLimitPolicy {

    private final LedgerProperties properties;

    public Optional<BigDecimal> resolveCap(UserBalance user) {
        if (user.isAdmin() || user.hasActiveSubscription()) {
            return Optional.empty();
        }

        LedgerProperties.DailyLimit limits = properties.getDailyLimit();
        String partnerCode = user.getPartnerCode();
        if (partnerCode != null && !partnerCode.isBlank()) {
            String code = partnerCode.trim();
            Optional<BigDecimal> partnerCap = limits.getPartnerCaps().entrySet().stream()
                .filter(entry -> entry.getKey().equalsIgnoreCase(code))
                .map(Map.Entry::getValue)
                .findFirst();
            if (partnerCap.isPresent()) {
                return partnerCap;
            }
        }
        return Optional.of(limits.getDefaultCap());
    }
}
