package com.flagship.credit_ledger.observability;

import com.flagship.credit_ledger.credit.DeductionResult;
import com.flagship.credit_ledger.exception.LedgerErrorKind;
import com.flagship.credit_ledger.ledger.TransactionType;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.function.Supplier;

/**
 * Centralized metrics for ledger operations.
 *
 * Metrics exposed:
 * - ledger.deductions: Counter of deduct outcomes, tagged by status
 * - ledger.deductions.rejected: Counter of rejected deductions, tagged by error kind
 * - ledger.credits.deducted: Dollars deducted, tagged by pool
 * - ledger.cas.conflicts: Counter of stale-snapshot writes
 * - ledger.credits.added: Counter of credit grants, tagged by type
 * - ledger.allowance.changes: Counter of resets and forfeitures
 * - ledger.cache: Counter of balance cache lookups, tagged by result
 * - ledger.store.retries / ledger.store.retries.exhausted: transient retry activity
 * - ledger.billing.incidents: Counter of missed settlements needing reconciliation
 * - ledger.deduct.duration: Timer for the full deduct pipeline
 */
@Component
public class LedgerMetrics {

    private final MeterRegistry registry;

    private final Counter casConflicts;
    private final Timer deductTimer;

    public LedgerMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.casConflicts = Counter.builder("ledger.cas.conflicts")
                .description("Balance writes rejected because the snapshot was stale")
                .register(registry);

        this.deductTimer = Timer.builder("ledger.deduct.duration")
                .description("Time taken by the full deduct pipeline")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry);
    }

    // ==================== Deductions ====================

    public void recordDeduction(DeductionResult result) {
        registry.counter("ledger.deductions",
                "status", result.getStatus().name().toLowerCase()
        ).increment();

        if (result.isCharged()) {
            recordDeductedAmount("allowance", result.getAllocation().getFromAllowance());
            recordDeductedAmount("purchased", result.getAllocation().getFromPurchased());
        }
    }

    public void recordDeductionRejected(LedgerErrorKind kind) {
        registry.counter("ledger.deductions.rejected",
                "kind", kind.name().toLowerCase()
        ).increment();
    }

    public void recordCasConflict() {
        casConflicts.increment();
    }

    public <T> T timeDeduction(Supplier<T> operation) {
        return deductTimer.record(operation);
    }

    private void recordDeductedAmount(String pool, BigDecimal amount) {
        if (amount.signum() == 0) {
            return;
        }
        DistributionSummary.builder("ledger.credits.deducted")
                .description("Dollars deducted per call")
                .baseUnit("usd")
                .tag("pool", pool)
                .register(registry)
                .record(amount.doubleValue());
    }

    // ==================== Grants and lifecycle ====================

    public void recordCreditsAdded(TransactionType type) {
        registry.counter("ledger.credits.added",
                "type", type.dbValue()
        ).increment();
    }

    public void recordAllowanceChange(TransactionType type) {
        registry.counter("ledger.allowance.changes",
                "type", type.dbValue()
        ).increment();
    }

    // ==================== Cache and store ====================

    public void recordCacheLookup(boolean hit) {
        registry.counter("ledger.cache", "result", hit ? "hit" : "miss").increment();
    }

    public void recordRetry(String operation) {
        registry.counter("ledger.store.retries",
                "operation", sanitizeTag(operation)
        ).increment();
    }

    public void recordRetryExhausted(String operation) {
        registry.counter("ledger.store.retries.exhausted",
                "operation", sanitizeTag(operation)
        ).increment();
    }

    public void recordBillingIncident(LedgerErrorKind kind) {
        registry.counter("ledger.billing.incidents",
                "kind", kind != null ? kind.name().toLowerCase() : "unknown"
        ).increment();
    }

    /**
     * Keeps tag cardinality bounded.
     */
    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
