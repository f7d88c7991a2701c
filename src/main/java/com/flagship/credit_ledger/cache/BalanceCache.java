package com.flagship.credit_ledger.cache;

import com.flagship.credit_ledger.balance.UserBalance;

import java.time.Duration;
import java.util.Optional;
import java.util.function.Function;

/**
 * Read-through cache of balance snapshots, keyed by user id.
 *
 * Only used on read paths. Deductions always read the store directly, so a
 * stale entry can at worst make a pre-check look more or less generous than
 * the store; it can never cause an overspend. Entries are dropped after
 * every committed balance change and expire after {@link #ttl()} regardless.
 */
public interface BalanceCache {

    /**
     * Returns the cached snapshot, or loads it. A loader result of empty is
     * passed through and never cached.
     */
    Optional<UserBalance> get(String userId, Function<String, Optional<UserBalance>> loader);

    void invalidate(String userId);

    Duration ttl();
}
