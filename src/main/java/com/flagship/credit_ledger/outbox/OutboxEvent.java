package com.flagship.credit_ledger.outbox;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * A ledger event waiting in the outbox table to be published to Kafka.
 *
 * Written in the same database transaction as the balance change that
 * caused it, so an event exists if and only if the change committed.
 */
@Value
public class OutboxEvent {
    UUID id;
    String aggregateType;      // "UserBalance"
    String aggregateId;        // user id, also the Kafka key
    String eventType;          // "BalanceChanged", "LowBalance"
    String payload;            // JSON
    Instant createdAt;
    Instant publishedAt;       // null until published
    int retryCount;
    String lastError;
    Long sequenceNumber;

    public static OutboxEvent create(String aggregateType, String aggregateId,
                                     String eventType, String payload, Instant createdAt) {
        return new OutboxEvent(
            UUID.randomUUID(),
            aggregateType,
            aggregateId,
            eventType,
            payload,
            createdAt,
            null,
            0,
            null,
            null   // assigned by the database
        );
    }

    public boolean isPublished() {
        return publishedAt != null;
    }
}
