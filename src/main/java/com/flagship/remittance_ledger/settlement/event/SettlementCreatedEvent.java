package com.flagship.remittance_ledger.settlement.event;

import com.flagship.remittance_ledger.common.CurrencyCode;
import com.flagship.remittance_ledger.remittance.RemittanceStatus;
import com.flagship.remittance_ledger.remittance.event.RemittanceEvent;
import com.flagship.remittance_ledger.settlement.Settlement;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Published for every settlement, carrying both sides' status after the change.
 */
@Value
public class SettlementCreatedEvent implements RemittanceEvent {

    public static final String EVENT_TYPE = "SettlementCreated";

    UUID eventId;
    UUID tenantId;
    UUID settlementId;
    UUID outgoingRemittanceId;
    UUID incomingRemittanceId;
    CurrencyCode currency;
    BigDecimal settledAmount;
    BigDecimal profit;
    RemittanceStatus outgoingStatus;
    RemittanceStatus incomingStatus;
    Instant occurredAt;

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static SettlementCreatedEvent of(Settlement settlement, CurrencyCode currency,
                                            RemittanceStatus outgoingStatus, RemittanceStatus incomingStatus) {
        return new SettlementCreatedEvent(
            UUID.randomUUID(),
            settlement.getTenantId(),
            settlement.getId(),
            settlement.getOutgoingRemittanceId(),
            settlement.getIncomingRemittanceId(),
            currency,
            settlement.getSettledAmount(),
            settlement.getProfit(),
            outgoingStatus,
            incomingStatus,
            settlement.getCreatedAt()
        );
    }
}
