package com.avocado.bonus_ledger.outbox;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * An event waiting in the outbox table to be published to Kafka.
 *
 * Written in the same database transaction as the ledger change it describes, so
 * a rolled-back posting never produces a notification.
 */
@Value
public class OutboxEvent {
    UUID id;
    String aggregateType;      // e.g. "ClientBonus"
    String aggregateId;        // e.g. client id, also the Kafka key
    String eventType;          // e.g. "BonusBalanceChanged"
    String payload;            // JSON
    Instant createdAt;
    Instant publishedAt;       // null until published
    int retryCount;
    String lastError;
    Long sequenceNumber;

    public static OutboxEvent create(String aggregateType, String aggregateId,
                                     String eventType, String payload) {
        return new OutboxEvent(
            UUID.randomUUID(),
            aggregateType,
            aggregateId,
            eventType,
            payload,
            Instant.now(),
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
