package com.flagship.remittance_ledger.settlement;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * One netting of part of an outgoing debt against part of an incoming fund.
 * Rates are snapshots taken at settlement time. Never updated after creation.
 */
@Value
@Builder
public class Settlement {
    UUID id;
    UUID tenantId;
    UUID outgoingRemittanceId;
    UUID incomingRemittanceId;
    BigDecimal settledAmount;
    BigDecimal acquisitionRate;
    BigDecimal payoutRate;
    BigDecimal profit;
    String notes;
    UUID createdBy;
    Instant createdAt;
}
