package com.flagship.remittance_ledger.remittance;

import com.flagship.remittance_ledger.common.CurrencyCode;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Open outgoing debt of a tenant, grouped by status and by age.
 * Remaining amounts are kept per currency; summing across currencies means nothing.
 */
@Value
@Builder
public class UnsettledSummary {
    long totalCount;
    Map<CurrencyCode, BigDecimal> totalRemaining;
    Map<RemittanceStatus, Bucket> byStatus;
    List<AgeBucket> byAge;
    Instant generatedAt;

    @Value
    public static class Bucket {
        long count;
        Map<CurrencyCode, BigDecimal> remaining;
    }

    @Value
    public static class AgeBucket {
        String label;
        long count;
        Map<CurrencyCode, BigDecimal> remaining;
    }
}
