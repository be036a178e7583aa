package com.flagship.remittance_ledger.remittance;

import java.math.BigDecimal;

/**
 * Lifecycle of outgoing and incoming remittances.
 *
 * PENDING, PARTIAL and COMPLETED are derived from the balances after every
 * settlement. PAID (incoming only) and CANCELLED are set explicitly.
 */
public enum RemittanceStatus {
    /**
     * Nothing settled yet.
     */
    PENDING,

    /**
     * Part of the amount has been settled, the rest is still open.
     */
    PARTIAL,

    /**
     * Fully settled. Terminal for settlement; an incoming may still be paid out.
     */
    COMPLETED,

    /**
     * Incoming recipient has been paid. Terminal.
     */
    PAID,

    /**
     * Cancelled before any settlement. Terminal.
     */
    CANCELLED;

    /**
     * Derives the status from the settled and remaining balances.
     */
    public static RemittanceStatus fromBalances(BigDecimal settled, BigDecimal remaining) {
        if (remaining.signum() == 0) {
            return COMPLETED;
        }
        return settled.signum() > 0 ? PARTIAL : PENDING;
    }

    /**
     * Whether the record can take part in a settlement.
     */
    public boolean isOpen() {
        return this == PENDING || this == PARTIAL;
    }

    public boolean isTerminal() {
        return !isOpen();
    }
}
