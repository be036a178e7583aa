package com.flagship.remittance_ledger.ledger;

import com.flagship.remittance_ledger.common.CurrencyCode;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Immutable row of {@code cash_ledger_entries}.
 */
@Value
public class CashLedgerEntry {
    UUID id;
    UUID tenantId;
    UUID branchId;
    CurrencyCode currency;
    BigDecimal amount;
    CashEntryType entryType;
    String referenceType;
    UUID referenceId;
    String description;
    UUID createdBy;
    Instant createdAt;
    long sequenceNumber;
}
