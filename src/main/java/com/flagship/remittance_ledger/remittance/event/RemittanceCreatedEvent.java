package com.flagship.remittance_ledger.remittance.event;

import com.flagship.remittance_ledger.common.CurrencyCode;
import com.flagship.remittance_ledger.remittance.IncomingRemittance;
import com.flagship.remittance_ledger.remittance.OutgoingRemittance;
import com.flagship.remittance_ledger.remittance.RemittanceDirection;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
public class RemittanceCreatedEvent implements RemittanceEvent {

    public static final String EVENT_TYPE = "RemittanceCreated";

    UUID eventId;
    UUID tenantId;
    UUID remittanceId;
    String remittanceCode;
    RemittanceDirection direction;
    UUID branchId;
    CurrencyCode currency;
    BigDecimal amount;
    BigDecimal rate;
    CurrencyCode fundingCurrency;
    Instant occurredAt;

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static RemittanceCreatedEvent fromOutgoing(OutgoingRemittance o) {
        return new RemittanceCreatedEvent(UUID.randomUUID(), o.getTenantId(), o.getId(), o.getRemittanceCode(), RemittanceDirection.OUTGOING,
            o.getBranchId(), o.getCurrency(), o.getAmount(), o.getAcquisitionRate(), o.getFundingCurrency(), o.getCreatedAt());
    }

    public static RemittanceCreatedEvent fromIncoming(IncomingRemittance i) {
        return new RemittanceCreatedEvent(UUID.randomUUID(), i.getTenantId(), i.getId(), i.getRemittanceCode(), RemittanceDirection.INCOMING,
            i.getBranchId(), i.getCurrency(), i.getAmount(), i.getPayoutRate(), i.getFundingCurrency(), i.getCreatedAt());
    }
}
