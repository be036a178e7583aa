package com.flagship.remittance_ledger.exception;

public class RemittanceValidationException extends RemittanceLedgerException {

    public RemittanceValidationException(String message) {
        super(message);
    }

    @Override
    public ErrorCode getErrorCode() {
        return ErrorCode.VALIDATION_ERROR;
    }
}
