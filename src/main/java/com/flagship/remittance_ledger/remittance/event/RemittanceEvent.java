package com.flagship.remittance_ledger.remittance.event;

import java.time.Instant;
import java.util.UUID;

/**
 * Payload contract for events relayed through the outbox.
 */
public interface RemittanceEvent {

    /**
     * Unique per event instance; consumers deduplicate on it.
     */
    UUID getEventId();

    String getEventType();

    UUID getTenantId();

    Instant getOccurredAt();
}
