package com.flagship.remittance_ledger.exception;

/**
 * Raised once lock-timeout / deadlock retries are exhausted.
 * The caller may retry the whole request; nothing was committed.
 */
public class SettlementConflictException extends RemittanceLedgerException {

    public SettlementConflictException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public ErrorCode getErrorCode() {
        return ErrorCode.CONFLICT;
    }
}
