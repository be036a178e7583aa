package com.flagship.remittance_ledger.settlement;

public enum AutoSettleOutcome {
    /** Outgoing remaining reached zero. */
    ALL_SETTLED,
    /** At least one settlement was created but some debt is still open. */
    PARTIALLY_SETTLED,
    /** Nothing was settled. */
    NO_FUNDS_AVAILABLE;

    static AutoSettleOutcome of(int settlementsCreated, boolean outgoingCleared) {
        if (outgoingCleared) {
            return ALL_SETTLED;
        }
        return settlementsCreated > 0 ? PARTIALLY_SETTLED : NO_FUNDS_AVAILABLE;
    }
}
