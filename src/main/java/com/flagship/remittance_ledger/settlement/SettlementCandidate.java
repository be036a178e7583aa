package com.flagship.remittance_ledger.settlement;

import com.flagship.remittance_ledger.remittance.IncomingRemittance;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Snapshot of an open incoming remittance, as seen by the strategy selector.
 */
@Value
public class SettlementCandidate {
    UUID incomingId;
    String incomingCode;
    BigDecimal remainingAmount;
    BigDecimal payoutRate;
    Instant createdAt;

    public static SettlementCandidate of(IncomingRemittance incoming) {
        return new SettlementCandidate(incoming.getId(), incoming.getRemittanceCode(),
            incoming.getRemainingAmount(), incoming.getPayoutRate(), incoming.getCreatedAt());
    }
}
