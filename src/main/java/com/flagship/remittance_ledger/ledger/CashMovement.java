package com.flagship.remittance_ledger.ledger;

import com.flagship.remittance_ledger.common.CurrencyCode;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * A signed cash movement about to be posted. Positive increases the
 * (tenant, branch, currency) balance, negative decreases it.
 */
@Value
@Builder
public class CashMovement {
    UUID tenantId;
    UUID branchId;
    CurrencyCode currency;
    BigDecimal amount;
    CashEntryType entryType;
    String referenceType;
    UUID referenceId;
    String description;
    UUID createdBy;
}
