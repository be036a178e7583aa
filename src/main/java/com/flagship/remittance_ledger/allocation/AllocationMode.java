package com.flagship.remittance_ledger.allocation;

import com.flagship.remittance_ledger.exception.RemittanceValidationException;

import java.util.Locale;

public enum AllocationMode {
    /** Oldest item first. */
    FIFO,
    /** Newest item first. */
    LIFO,
    /** Highest rate first, oldest first on ties. */
    BEST_RATE,
    /** Every item gets a share proportional to its remaining balance. */
    PROPORTIONAL;

    public static AllocationMode parse(String value) {
        if (value == null || value.isBlank()) {
            return FIFO;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new RemittanceValidationException("Unknown allocation strategy: " + value);
        }
    }
}
