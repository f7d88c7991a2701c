package com.flagship.credit_ledger.event;

import com.flagship.credit_ledger.ledger.CreditTransaction;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Emitted for every recorded transaction. Carries the ledger transaction id
 * so consumers can correlate with the audit trail.
 */
@Value
public class BalanceChangedEvent implements LedgerEvent {
    UUID eventId;
    String userId;
    UUID transactionId;
    String transactionType;
    BigDecimal amount;
    BigDecimal balanceBefore;
    BigDecimal balanceAfter;
    Instant occurredAt;

    public static final String EVENT_TYPE = "BalanceChanged";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static BalanceChangedEvent fromTransaction(CreditTransaction transaction) {
        return new BalanceChangedEvent(
            UUID.randomUUID(),
            transaction.getUserId(),
            transaction.getId(),
            transaction.getTransactionType().dbValue(),
            transaction.getAmount(),
            transaction.getBalanceBefore(),
            transaction.getBalanceAfter(),
            transaction.getCreatedAt()
        );
    }
}
