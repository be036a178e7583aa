package com.flagship.remittance_ledger.allocation;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Something with an open balance that a payment can be spread over.
 * {@code rate} is only read by {@link AllocationMode#BEST_RATE}.
 */
@Value
public class OpenItem {
    UUID id;
    Instant createdAt;
    BigDecimal remaining;
    BigDecimal rate;
}
