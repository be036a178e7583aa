package com.flagship.remittance_ledger.settlement;

import com.flagship.remittance_ledger.exception.RemittanceValidationException;

import java.util.Locale;

/**
 * Order in which open incoming funds are matched against a debt.
 */
public enum SettlementStrategy {
    /** Oldest incoming first. */
    FIFO,
    /** Newest incoming first. */
    LIFO,
    /** Highest per-unit margin first, oldest first on ties. */
    BEST_RATE;

    /**
     * Parses a strategy name; blank means FIFO.
     */
    public static SettlementStrategy parse(String value) {
        if (value == null || value.isBlank()) {
            return FIFO;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new RemittanceValidationException("Unknown settlement strategy: " + value);
        }
    }
}
