package com.flagship.credit_ledger.event;

import com.flagship.credit_ledger.ledger.CreditTransaction;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Emitted once when a transaction takes the spendable total from at or
 * above the configured threshold to below it.
 */
@Value
public class LowBalanceEvent implements LedgerEvent {
    UUID eventId;
    String userId;
    UUID transactionId;
    BigDecimal balance;
    BigDecimal threshold;
    Instant occurredAt;

    public static final String EVENT_TYPE = "LowBalance";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static LowBalanceEvent fromTransaction(CreditTransaction transaction, BigDecimal threshold) {
        return new LowBalanceEvent(
            UUID.randomUUID(),
            transaction.getUserId(),
            transaction.getId(),
            transaction.getBalanceAfter(),
            threshold,
            transaction.getCreatedAt()
        );
    }

    /**
     * @return true if the transaction crossed the threshold downwards
     */
    public static boolean crossesThreshold(CreditTransaction transaction, BigDecimal threshold) {
        return transaction.getBalanceBefore().compareTo(threshold) >= 0
            && transaction.getBalanceAfter().compareTo(threshold) < 0;
    }
}
