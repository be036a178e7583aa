package com.flagship.remittance_ledger.outbox;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * A remittance or settlement event waiting in the outbox table.
 *
 * Written in the same transaction as the state change it describes, then
 * relayed to Kafka by {@link OutboxPublisher}. Immutable; state changes
 * return new instances.
 */
@Value
public class OutboxEvent {
    UUID id;
    String aggregateType;      // OutgoingRemittance, IncomingRemittance, Settlement
    UUID aggregateId;
    String eventType;          // e.g. SettlementCreated
    String payload;            // JSON
    Instant createdAt;
    Instant publishedAt;       // null until relayed
    int retryCount;
    String lastError;
    Long sequenceNumber;

    public static OutboxEvent create(String aggregateType, UUID aggregateId,
                                     String eventType, String payload, Instant now) {
        return new OutboxEvent(
            UUID.randomUUID(),
            aggregateType,
            aggregateId,
            eventType,
            payload,
            now,
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
