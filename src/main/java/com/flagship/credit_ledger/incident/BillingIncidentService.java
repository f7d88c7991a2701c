package com.flagship.credit_ledger.incident;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.credit_ledger.exception.LedgerErrorKind;
import com.flagship.credit_ledger.exception.LedgerException;
import com.flagship.credit_ledger.observability.LedgerMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Records usage that was delivered but not charged.
 *
 * The error log line is the primary signal and is written before the row,
 * so it survives even when the database is the thing that failed.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BillingIncidentService {

    public static final String LOG_MARKER = "BILLING_RECONCILIATION_NEEDED";

    private final BillingIncidentRepository repository;
    private final ObjectMapper objectMapper;
    private final LedgerMetrics metrics;
    private final Clock clock;

    /**
     * Writes in its own transaction so the row commits even though the
     * failed deduction rolled back.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public BillingIncidentEntity recordMissedDeduction(String userId, BigDecimal amount, String description,
                                                       Map<String, Object> metadata, Throwable error) {
        LedgerErrorKind kind = error instanceof LedgerException ledgerError ? ledgerError.getKind() : null;
        String errorKind = kind != null ? kind.name() : error.getClass().getSimpleName();

        log.error("{}: usage delivered but not charged. userId={}, amount={}, description={}, errorKind={}, error={}",
            LOG_MARKER, userId, amount.toPlainString(), description, errorKind, error.getMessage());
        metrics.recordBillingIncident(kind);

        BillingIncidentEntity incident = new BillingIncidentEntity();
        incident.setId(UUID.randomUUID());
        incident.setUserId(userId);
        incident.setAmount(amount);
        incident.setDescription(description);
        incident.setErrorKind(errorKind.length() > 32 ? errorKind.substring(0, 32) : errorKind);
        incident.setErrorMessage(error.getMessage());
        incident.setMetadata(serialize(metadata));
        incident.setStatus(BillingIncidentStatus.PENDING.dbValue());
        incident.setCreatedAt(clock.instant());
        return repository.save(incident);
    }

    @Transactional(readOnly = true)
    public List<BillingIncidentEntity> findByUser(String userId) {
        return repository.findByUserIdOrderByCreatedAtDesc(userId);
    }

    @Transactional(readOnly = true)
    public long countPending() {
        return repository.countByStatus(BillingIncidentStatus.PENDING.dbValue());
    }

    private String serialize(Map<String, Object> metadata) {
        try {
            return objectMapper.writeValueAsString(metadata != null ? metadata : Map.of());
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize incident metadata", e);
        }
    }
}
