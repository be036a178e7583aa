package com.flagship.remittance_ledger.settlement.dto;

import com.flagship.remittance_ledger.settlement.Settlement;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class SettlementResponse {
    UUID id;
    UUID outgoingRemittanceId;
    UUID incomingRemittanceId;
    BigDecimal settledAmount;
    BigDecimal acquisitionRate;
    BigDecimal payoutRate;
    BigDecimal profit;
    String notes;
    UUID createdBy;
    Instant createdAt;

    public static SettlementResponse from(Settlement settlement) {
        return SettlementResponse.builder()
            .id(settlement.getId())
            .outgoingRemittanceId(settlement.getOutgoingRemittanceId())
            .incomingRemittanceId(settlement.getIncomingRemittanceId())
            .settledAmount(settlement.getSettledAmount())
            .acquisitionRate(settlement.getAcquisitionRate())
            .payoutRate(settlement.getPayoutRate())
            .profit(settlement.getProfit())
            .notes(settlement.getNotes())
            .createdBy(settlement.getCreatedBy())
            .createdAt(settlement.getCreatedAt())
            .build();
    }
}
