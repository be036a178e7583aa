package com.flagship.remittance_ledger.settlement;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

@Value
@Builder
public class SettleCommand {
    UUID tenantId;
    UUID outgoingId;
    UUID incomingId;
    BigDecimal amount;
    UUID actorId;
    String notes;
}
