package com.flagship.credit_ledger.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.credit_ledger.cache.BalanceCache;
import com.flagship.credit_ledger.cache.CaffeineBalanceCache;
import com.flagship.credit_ledger.cache.RedisBalanceCache;
import com.flagship.credit_ledger.observability.LedgerMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

/**
 * Picks the balance cache implementation from ledger.cache.type.
 */
@Configuration
@Slf4j
public class CacheConfig {

    @Bean
    public BalanceCache balanceCache(LedgerProperties properties,
                                     LedgerMetrics metrics,
                                     ObjectMapper objectMapper,
                                     ObjectProvider<StringRedisTemplate> redisTemplate) {
        LedgerProperties.Cache cache = properties.getCache();
        log.info("Balance cache: type={}, ttl={}", cache.getType(), cache.getTtl());

        return switch (cache.getType()) {
            case REDIS -> new RedisBalanceCache(redisTemplate.getObject(), objectMapper, cache.getTtl(), metrics);
            case CAFFEINE -> new CaffeineBalanceCache(cache.getTtl(), cache.getMaximumSize(), metrics);
        };
    }
}
