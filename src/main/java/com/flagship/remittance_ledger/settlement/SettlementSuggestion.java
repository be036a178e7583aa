package com.flagship.remittance_ledger.settlement;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Advisory only. The settlement primitive re-validates everything at commit time.
 */
@Value
public class SettlementSuggestion {
    UUID incomingId;
    String incomingCode;
    BigDecimal suggestedAmount;
    BigDecimal expectedProfit;
    BigDecimal payoutRate;
    BigDecimal incomingRemaining;
    Instant createdAt;
    /** Why the candidate sits at this position, e.g. its receipt date or its rate margin rank. */
    String reason;
}
