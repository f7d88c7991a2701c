package com.flagship.credit_ledger.balance;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Snapshot of one row of the users table.
 *
 * Key invariant: both balance fields are non-negative (also enforced by
 * CHECK constraints). Their sum is the spendable total.
 *
 * trialExpiresAt is kept as the raw stored text. It is parsed only when
 * trial expiration is validated, so a malformed value never prevents the
 * row from loading.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class UserBalance {
    String userId;
    BigDecimal subscriptionAllowance;
    BigDecimal purchasedCredits;
    Tier tier;
    SubscriptionStatus subscriptionStatus;
    String trialExpiresAt;
    String partnerCode;
    Instant updatedAt;

    @JsonIgnore
    public BigDecimal getTotal() {
        return subscriptionAllowance.add(purchasedCredits);
    }

    @JsonIgnore
    public boolean isAdmin() {
        return tier == Tier.ADMIN;
    }

    @JsonIgnore
    public boolean isOnTrial() {
        return subscriptionStatus == SubscriptionStatus.TRIAL;
    }

    @JsonIgnore
    public boolean hasActiveSubscription() {
        return subscriptionStatus == SubscriptionStatus.ACTIVE;
    }
}
