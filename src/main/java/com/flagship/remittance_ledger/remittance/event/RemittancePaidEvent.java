package com.flagship.remittance_ledger.remittance.event;

import com.flagship.remittance_ledger.common.CurrencyCode;
import com.flagship.remittance_ledger.remittance.IncomingRemittance;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
public class RemittancePaidEvent implements RemittanceEvent {

    public static final String EVENT_TYPE = "RemittancePaid";

    UUID eventId;
    UUID tenantId;
    UUID remittanceId;
    String remittanceCode;
    CurrencyCode fundingCurrency;
    BigDecimal paidAmount;
    String paymentMethod;
    UUID paidBy;
    Instant occurredAt;

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static RemittancePaidEvent fromIncoming(IncomingRemittance i) {
        return new RemittancePaidEvent(UUID.randomUUID(), i.getTenantId(), i.getId(), i.getRemittanceCode(), i.getFundingCurrency(),
            i.getPaidAmount(), i.getPaymentMethod(), i.getPaidBy(), i.getPaidAt());
    }
}
