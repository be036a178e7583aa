package com.flagship.remittance_ledger.exception;

import java.util.UUID;

/**
 * The remittance is in a state that does not permit the requested operation,
 * e.g. settling a COMPLETED record or cancelling a partially settled one.
 */
public class InvalidRemittanceStateException extends RemittanceLedgerException {

    private final UUID remittanceId;

    public InvalidRemittanceStateException(UUID remittanceId, String message) {
        super(message);
        this.remittanceId = remittanceId;
    }

    public UUID getRemittanceId() {
        return remittanceId;
    }

    @Override
    public ErrorCode getErrorCode() {
        return ErrorCode.INVALID_STATE;
    }
}
