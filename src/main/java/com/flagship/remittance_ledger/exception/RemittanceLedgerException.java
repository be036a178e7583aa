package com.flagship.remittance_ledger.exception;

/**
 * Base type for every business failure raised by the engine.
 * Each subtype maps to exactly one {@link ErrorCode}.
 */
public abstract class RemittanceLedgerException extends RuntimeException {

    protected RemittanceLedgerException(String message) {
        super(message);
    }

    protected RemittanceLedgerException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract ErrorCode getErrorCode();
}
