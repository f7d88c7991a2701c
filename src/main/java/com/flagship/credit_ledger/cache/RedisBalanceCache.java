package com.flagship.credit_ledger.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.credit_ledger.balance.UserBalance;
import com.flagship.credit_ledger.observability.LedgerMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Duration;
import java.util.Optional;
import java.util.function.Function;

/**
 * Shared cache in Redis, for deployments running several instances.
 *
 * Redis is best effort: any Redis failure is logged and the call falls
 * through to the loader, so a Redis outage only costs latency.
 */
@Slf4j
public class RedisBalanceCache implements BalanceCache {

    static final String KEY_PREFIX = "credit-ledger:balance:";

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;
    private final Duration ttl;
    private final LedgerMetrics metrics;

    public RedisBalanceCache(StringRedisTemplate redisTemplate, ObjectMapper objectMapper,
                             Duration ttl, LedgerMetrics metrics) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
        this.ttl = ttl;
        this.metrics = metrics;
    }

    @Override
    public Optional<UserBalance> get(String userId, Function<String, Optional<UserBalance>> loader) {
        Optional<UserBalance> cached = read(userId);
        if (cached.isPresent()) {
            metrics.recordCacheLookup(true);
            return cached;
        }

        metrics.recordCacheLookup(false);
        Optional<UserBalance> loaded = loader.apply(userId);
        loaded.ifPresent(this::write);
        return loaded;
    }

    @Override
    public void invalidate(String userId) {
        try {
            redisTemplate.delete(KEY_PREFIX + userId);
        } catch (DataAccessException e) {
            log.warn("Failed to invalidate cached balance for user {}, entry expires within {}: {}",
                    userId, ttl, e.getMessage());
        }
    }

    @Override
    public Duration ttl() {
        return ttl;
    }

    private Optional<UserBalance> read(String userId) {
        try {
            String json = redisTemplate.opsForValue().get(KEY_PREFIX + userId);
            if (json == null) {
                return Optional.empty();
            }
            return Optional.of(objectMapper.readValue(json, UserBalance.class));
        } catch (DataAccessException e) {
            log.warn("Redis read failed for user {}, reading from store: {}", userId, e.getMessage());
            return Optional.empty();
        } catch (JsonProcessingException e) {
            log.warn("Discarding unreadable cached balance for user {}: {}", userId, e.getMessage());
            invalidate(userId);
            return Optional.empty();
        }
    }

    private void write(UserBalance balance) {
        try {
            redisTemplate.opsForValue().set(KEY_PREFIX + balance.getUserId(),
                    objectMapper.writeValueAsString(balance), ttl);
        } catch (DataAccessException | JsonProcessingException e) {
            log.warn("Failed to cache balance for user {}: {}", balance.getUserId(), e.getMessage());
        }
    }
}
