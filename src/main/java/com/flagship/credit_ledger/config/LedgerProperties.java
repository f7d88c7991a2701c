package com.flagship.credit_ledger.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

/**
 * Typed binding for the {@code ledger.*} section of application.yml.
 *
 * <pre>
 * ledger:
 *   trial:
 *     allowance: 5.00
 *     duration: 3d
 *   daily-limit:
 *     default-cap: 1.00
 *     partner-caps:
 *       REDBEARD: 5.00
 *   cache:
 *     type: caffeine      # or redis
 *     ttl: 300s
 *   retry:
 *     max-attempts: 3
 *     initial-delay: 500ms
 *     multiplier: 2.0
 *     max-delay: 2s
 * </pre>
 */
@Data
@ConfigurationProperties(prefix = "ledger")
public class LedgerProperties {

    private Trial trial = new Trial();
    private DailyLimit dailyLimit = new DailyLimit();
    private Cache cache = new Cache();
    private Retry retry = new Retry();
    private Events events = new Events();

    /**
     * A debit that takes the spendable total from at-or-above this value to
     * below it emits a LowBalance event.
     */
    private BigDecimal lowBalanceThreshold = new BigDecimal("1.00");

    @Data
    public static class Trial {
        private BigDecimal allowance = new BigDecimal("5.00");
        private Duration duration = Duration.ofDays(3);
    }

    @Data
    public static class DailyLimit {
        private BigDecimal defaultCap = new BigDecimal("1.00");
        /** Keyed by partner code, matched case-insensitively. */
        private Map<String, BigDecimal> partnerCaps = new HashMap<>();
    }

    @Data
    public static class Cache {
        private CacheType type = CacheType.CAFFEINE;
        private Duration ttl = Duration.ofSeconds(300);
        private long maximumSize = 10_000;
    }

    public enum CacheType {
        CAFFEINE,
        REDIS
    }

    @Data
    public static class Retry {
        private int maxAttempts = 3;
        private Duration initialDelay = Duration.ofMillis(500);
        private double multiplier = 2.0;
        private Duration maxDelay = Duration.ofSeconds(2);
    }

    @Data
    public static class Events {
        private String topic = "credit-ledger-events";
        private int partitions = 3;
    }
}
