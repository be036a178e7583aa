package com.flagship.remittance_ledger.settlement;

import com.flagship.remittance_ledger.remittance.RemittanceStatus;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

@Value
@Builder
public class AutoSettleResult {
    UUID outgoingId;
    SettlementStrategy strategy;
    AutoSettleOutcome outcome;
    BigDecimal totalSettled;
    BigDecimal totalProfit;
    RemittanceStatus outgoingStatus;
    BigDecimal outgoingRemaining;
    List<Settlement> settlements;
    List<SkippedCandidate> skipped;
}
