package com.flagship.remittance_ledger.settlement;

import com.flagship.remittance_ledger.exception.ErrorCode;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * A suggestion the auto-settle run could not apply, with the reason it was rejected.
 */
@Value
public class SkippedCandidate {
    UUID incomingId;
    String incomingCode;
    BigDecimal suggestedAmount;
    ErrorCode reason;
    String message;
}
