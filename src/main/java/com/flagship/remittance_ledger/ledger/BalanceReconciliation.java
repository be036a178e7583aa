package com.flagship.remittance_ledger.ledger;

import com.flagship.remittance_ledger.common.CurrencyCode;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Outcome of recomputing one stored balance from its ledger entries.
 * {@code drift = storedBalance - recomputedBalance}, measured before the overwrite.
 */
@Value
public class BalanceReconciliation {
    UUID tenantId;
    UUID branchId;
    CurrencyCode currency;
    BigDecimal storedBalance;
    BigDecimal recomputedBalance;
    BigDecimal drift;
    Instant refreshedAt;

    public boolean hasDrift() {
        return drift.signum() != 0;
    }
}
