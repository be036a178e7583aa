package com.flagship.remittance_ledger.remittance.event;

import com.flagship.remittance_ledger.remittance.RemittanceDirection;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
public class RemittanceCancelledEvent implements RemittanceEvent {

    public static final String EVENT_TYPE = "RemittanceCancelled";

    UUID eventId;
    UUID tenantId;
    UUID remittanceId;
    String remittanceCode;
    RemittanceDirection direction;
    UUID cancelledBy;
    String reason;
    Instant occurredAt;

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }
}
