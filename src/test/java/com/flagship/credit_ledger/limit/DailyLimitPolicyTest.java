package com.flagship.credit_ledger.limit;

import com.flagship.credit_ledger.balance.SubscriptionStatus;
import com.flagship.credit_ledger.balance.Tier;
import com.flagship.credit_ledger.balance.UserBalance;
import com.flagship.credit_ledger.config.LedgerProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class DailyLimitPolicyTest {

    private DailyLimitPolicy policy;

    @BeforeEach
    void setUp() {
        LedgerProperties properties = new LedgerProperties();
        properties.getDailyLimit().setDefaultCap(new BigDecimal("1.00"));
        properties.getDailyLimit().getPartnerCaps().put("REDBEARD", new BigDecimal("5.00"));
        policy = new DailyLimitPolicy(properties);
    }

    private UserBalance user(Tier tier, SubscriptionStatus status, String partnerCode) {
        return UserBalance.builder()
            .userId("user-1")
            .subscriptionAllowance(BigDecimal.ZERO)
            .purchasedCredits(BigDecimal.ZERO)
            .tier(tier)
            .subscriptionStatus(status)
            .partnerCode(partnerCode)
            .build();
    }

    @Test
    @DisplayName("Admins are unlimited, whatever their status")
    void adminUnlimited() {
        assertEquals(Optional.empty(), policy.resolveCap(user(Tier.ADMIN, SubscriptionStatus.TRIAL, "REDBEARD")));
    }

    @Test
    @DisplayName("Active paid subscribers are unlimited")
    void activeUnlimited() {
        assertEquals(Optional.empty(), policy.resolveCap(user(Tier.PRO, SubscriptionStatus.ACTIVE, null)));
    }

    @Test
    @DisplayName("Partner trial users get their partner cap, matched case-insensitively")
    void partnerCap() {
        assertEquals(Optional.of(new BigDecimal("5.00")),
            policy.resolveCap(user(Tier.BASIC, SubscriptionStatus.TRIAL, "redbeard")));
    }

    @Test
    @DisplayName("Unknown partner codes fall back to the default cap")
    void unknownPartner() {
        assertEquals(Optional.of(new BigDecimal("1.00")),
            policy.resolveCap(user(Tier.BASIC, SubscriptionStatus.TRIAL, "OTHER")));
    }

    @Test
    @DisplayName("Trial, cancelled and expired users get the default cap")
    void defaultCap() {
        assertEquals(Optional.of(new BigDecimal("1.00")),
            policy.resolveCap(user(Tier.BASIC, SubscriptionStatus.TRIAL, null)));
        assertEquals(Optional.of(new BigDecimal("1.00")),
            policy.resolveCap(user(Tier.PRO, SubscriptionStatus.CANCELLED, null)));
        assertEquals(Optional.of(new BigDecimal("1.00")),
            policy.resolveCap(user(Tier.MAX, SubscriptionStatus.EXPIRED, "  ")));
    }
}
