package com.flagship.credit_ledger.cache;

import com.flagship.credit_ledger.balance.SubscriptionStatus;
import com.flagship.credit_ledger.balance.Tier;
import com.flagship.credit_ledger.balance.UserBalance;
import com.flagship.credit_ledger.observability.LedgerMetrics;
import com.github.benmanes.caffeine.cache.Ticker;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class CaffeineBalanceCacheTest {

    private final AtomicLong nanos = new AtomicLong();
    private final Ticker ticker = nanos::get;
    private final AtomicInteger loads = new AtomicInteger();

    private SimpleMeterRegistry registry;
    private CaffeineBalanceCache cache;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        cache = new CaffeineBalanceCache(Duration.ofSeconds(300), 100, ticker, new LedgerMetrics(registry));
    }

    private Optional<UserBalance> load(String userId) {
        loads.incrementAndGet();
        return Optional.of(balance(userId, "5.000000"));
    }

    private static UserBalance balance(String userId, String allowance) {
        return UserBalance.builder()
            .userId(userId)
            .subscriptionAllowance(new BigDecimal(allowance))
            .purchasedCredits(BigDecimal.ZERO)
            .tier(Tier.BASIC)
            .subscriptionStatus(SubscriptionStatus.TRIAL)
            .build();
    }

    @Test
    @DisplayName("Second read within the TTL is served from the cache")
    void cachesHits() {
        cache.get("user-1", this::load);
        Optional<UserBalance> second = cache.get("user-1", this::load);

        assertTrue(second.isPresent());
        assertEquals(1, loads.get());
        assertEquals(1.0, registry.counter("ledger.cache", "result", "hit").count());
        assertEquals(1.0, registry.counter("ledger.cache", "result", "miss").count());
    }

    @Test
    @DisplayName("Entries expire after the TTL")
    void expiresAfterTtl() {
        cache.get("user-1", this::load);
        nanos.addAndGet(Duration.ofSeconds(301).toNanos());
        cache.get("user-1", this::load);

        assertEquals(2, loads.get());
    }

    @Test
    @DisplayName("Invalidation forces the next read to the store")
    void invalidation() {
        cache.get("user-1", this::load);
        cache.invalidate("user-1");
        cache.get("user-1", this::load);

        assertEquals(2, loads.get());
    }

    @Test
    @DisplayName("A missing user is never cached")
    void missesAreNotCached() {
        AtomicInteger lookups = new AtomicInteger();

        for (int i = 0; i < 3; i++) {
            Optional<UserBalance> result = cache.get("typo-user", id -> {
                lookups.incrementAndGet();
                return Optional.empty();
            });
            assertTrue(result.isEmpty());
        }

        assertEquals(3, lookups.get());
    }

    @Test
    @DisplayName("Reports its TTL")
    void reportsTtl() {
        assertEquals(Duration.ofSeconds(300), cache.ttl());
    }

    @Test
    @DisplayName("A snapshot loaded before a write is not cached past that write's invalidation")
    void invalidationDuringLoadWins() throws Exception {
        AtomicReference<UserBalance> store = new AtomicReference<>(balance("user-1", "5"));
        CountDownLatch snapshotTaken = new CountDownLatch(1);
        CountDownLatch releaseReader = new CountDownLatch(1);

        ExecutorService executor = Executors.newFixedThreadPool(2);
        try {
            Future<Optional<UserBalance>> reader = executor.submit(() -> cache.get("user-1", id -> {
                UserBalance snapshot = store.get();
                snapshotTaken.countDown();
                try {
                    releaseReader.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return Optional.of(snapshot);
            }));

            assertTrue(snapshotTaken.await(5, TimeUnit.SECONDS));

            // The write commits and invalidates while the reader still holds the old row
            store.set(balance("user-1", "4"));
            Future<?> invalidation = executor.submit(() -> cache.invalidate("user-1"));
            try {
                invalidation.get(200, TimeUnit.MILLISECONDS);
            } catch (TimeoutException e) {
                // Waiting on the in-flight load
            }

            releaseReader.countDown();
            assertEquals(0, new BigDecimal("5").compareTo(
                reader.get(5, TimeUnit.SECONDS).orElseThrow().getSubscriptionAllowance()));
            invalidation.get(5, TimeUnit.SECONDS);
        } finally {
            executor.shutdownNow();
        }

        UserBalance next = cache.get("user-1", id -> Optional.of(store.get())).orElseThrow();
        assertEquals(0, new BigDecimal("4").compareTo(next.getSubscriptionAllowance()),
            "writer's next read must see its own write");
    }
}
