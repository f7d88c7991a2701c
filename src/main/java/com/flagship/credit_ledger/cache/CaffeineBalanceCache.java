package com.flagship.credit_ledger.cache;

import com.flagship.credit_ledger.balance.UserBalance;
import com.flagship.credit_ledger.observability.LedgerMetrics;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Function;

/**
 * In-process cache. Each application instance has its own copy, so an
 * invalidation on one instance does not reach the others; the TTL bounds
 * how long they can lag.
 */
public class CaffeineBalanceCache implements BalanceCache {

    private final Cache<String, UserBalance> cache;
    private final Duration ttl;
    private final LedgerMetrics metrics;

    public CaffeineBalanceCache(Duration ttl, long maximumSize, LedgerMetrics metrics) {
        this(ttl, maximumSize, Ticker.systemTicker(), metrics);
    }

    CaffeineBalanceCache(Duration ttl, long maximumSize, Ticker ticker, LedgerMetrics metrics) {
        this.ttl = ttl;
        this.metrics = metrics;
        this.cache = Caffeine.newBuilder()
                .expireAfterWrite(ttl)
                .maximumSize(maximumSize)
                .ticker(ticker)
                .recordStats()
                .build();
    }

    /**
     * Loads through the cache atomically. An {@link #invalidate} racing an
     * in-flight load waits for it and then removes the loaded entry, so a
     * snapshot read before a commit is never cached after that commit's
     * invalidation. A load that finds no user caches nothing.
     */
    @Override
    public Optional<UserBalance> get(String userId, Function<String, Optional<UserBalance>> loader) {
        AtomicBoolean loaded = new AtomicBoolean(false);
        UserBalance balance = cache.get(userId, id -> {
            loaded.set(true);
            return loader.apply(id).orElse(null);
        });
        metrics.recordCacheLookup(!loaded.get());
        return Optional.ofNullable(balance);
    }

    @Override
    public void invalidate(String userId) {
        cache.invalidate(userId);
    }

    @Override
    public Duration ttl() {
        return ttl;
    }
}
