package com.flagship.remittance_ledger.ledger;

import com.flagship.remittance_ledger.common.CurrencyCode;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
public class CashBalance {
    UUID tenantId;
    UUID branchId;
    CurrencyCode currency;
    BigDecimal balance;
    Instant lastRecalculatedAt;
    Instant updatedAt;

    static CashBalance empty(UUID tenantId, UUID branchId, CurrencyCode currency) {
        return new CashBalance(tenantId, branchId, currency, BigDecimal.ZERO, null, null);
    }
}
