package com.flagship.remittance_ledger.exception;

import java.math.BigDecimal;

/**
 * Requested settlement amount exceeds what one of the two sides still has open.
 */
public class InsufficientFundsException extends RemittanceLedgerException {

    private final BigDecimal requested;
    private final BigDecimal available;

    public InsufficientFundsException(BigDecimal requested, BigDecimal available) {
        super("Requested " + requested.toPlainString() + " exceeds available " + available.toPlainString());
        this.requested = requested;
        this.available = available;
    }

    public BigDecimal getRequested() {
        return requested;
    }

    public BigDecimal getAvailable() {
        return available;
    }

    @Override
    public ErrorCode getErrorCode() {
        return ErrorCode.INSUFFICIENT_FUNDS;
    }
}
