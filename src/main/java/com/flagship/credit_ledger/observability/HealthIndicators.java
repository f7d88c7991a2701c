package com.flagship.credit_ledger.observability;

import com.flagship.credit_ledger.incident.BillingIncidentService;
import com.flagship.credit_ledger.outbox.OutboxEventRepository;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

/**
 * Health indicators for the credit ledger.
 */
public class HealthIndicators {

    /**
     * DOWN once the outbox backlog is large enough that ledger events are
     * clearly not reaching Kafka.
     */
    @Component("outboxHealth")
    public static class OutboxHealthIndicator implements HealthIndicator {

        static final long BACKLOG_WARNING_THRESHOLD = 1000;
        static final long BACKLOG_CRITICAL_THRESHOLD = 10000;

        private final OutboxEventRepository outboxRepository;

        public OutboxHealthIndicator(OutboxEventRepository outboxRepository) {
            this.outboxRepository = outboxRepository;
        }

        @Override
        public Health health() {
            try {
                long backlogSize = outboxRepository.countUnpublished();

                Health.Builder builder = backlogSize < BACKLOG_WARNING_THRESHOLD
                        ? Health.up()
                        : backlogSize < BACKLOG_CRITICAL_THRESHOLD
                        ? Health.status("WARNING")
                        : Health.down();

                return builder
                        .withDetail("backlogSize", backlogSize)
                        .withDetail("warningThreshold", BACKLOG_WARNING_THRESHOLD)
                        .withDetail("criticalThreshold", BACKLOG_CRITICAL_THRESHOLD)
                        .build();
            } catch (Exception e) {
                return Health.down()
                        .withDetail("error", e.getMessage())
                        .build();
            }
        }
    }

    /**
     * WARNING while delivered usage is waiting to be reconciled by hand.
     * Charging keeps working, so this is never DOWN.
     */
    @Component("billingIncidentHealth")
    public static class BillingIncidentHealthIndicator implements HealthIndicator {

        private final BillingIncidentService billingIncidentService;

        public BillingIncidentHealthIndicator(BillingIncidentService billingIncidentService) {
            this.billingIncidentService = billingIncidentService;
        }

        @Override
        public Health health() {
            try {
                long pending = billingIncidentService.countPending();
                Health.Builder builder = pending == 0 ? Health.up() : Health.status("WARNING");
                return builder
                        .withDetail("pendingIncidents", pending)
                        .build();
            } catch (Exception e) {
                return Health.down()
                        .withDetail("error", e.getMessage())
                        .build();
            }
        }
    }

    /**
     * Only registered when balances are cached in Redis. A Redis outage
     * degrades to direct store reads, so it is reported as DEGRADED rather
     * than DOWN.
     */
    @Component("balanceCacheHealth")
    @ConditionalOnProperty(name = "ledger.cache.type", havingValue = "redis")
    public static class RedisBalanceCacheHealthIndicator implements HealthIndicator {

        private static final String FALLBACK_NOTE = "Balance reads fall back to the database";

        private final StringRedisTemplate redisTemplate;

        public RedisBalanceCacheHealthIndicator(StringRedisTemplate redisTemplate) {
            this.redisTemplate = redisTemplate;
        }

        @Override
        public Health health() {
            RedisConnectionFactory connectionFactory = redisTemplate.getConnectionFactory();
            if (connectionFactory == null) {
                return Health.status("DEGRADED")
                        .withDetail("error", "No connection factory configured")
                        .withDetail("note", FALLBACK_NOTE)
                        .build();
            }

            try (RedisConnection connection = connectionFactory.getConnection()) {
                String result = connection.ping();
                if ("PONG".equals(result)) {
                    return Health.up().withDetail("response", result).build();
                }
                return Health.down()
                        .withDetail("response", result != null ? result : "null")
                        .build();
            } catch (Exception e) {
                return Health.status("DEGRADED")
                        .withDetail("error", e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName())
                        .withDetail("note", FALLBACK_NOTE)
                        .build();
            }
        }
    }
}
