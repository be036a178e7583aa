package com.flagship.remittance_ledger.allocation;

import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

@Value
public class Allocation {
    UUID itemId;
    BigDecimal remaining;
    BigDecimal allocated;

    public boolean isFullyCovered() {
        return allocated.compareTo(remaining) == 0;
    }
}
