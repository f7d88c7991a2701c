package com.flagship.credit_ledger.event;

import java.time.Instant;
import java.util.UUID;

/**
 * Base interface for events emitted through the outbox whenever a balance
 * changes.
 */
public interface LedgerEvent {

    /**
     * Unique per event instance, for consumer-side deduplication.
     */
    UUID getEventId();

    /**
     * The user whose balance changed. Also the Kafka key.
     */
    String getUserId();

    Instant getOccurredAt();

    String getEventType();
}
