package com.flagship.remittance_ledger.exception;

import java.util.UUID;

public class RemittanceNotFoundException extends RemittanceLedgerException {

    private final String entityType;
    private final UUID entityId;

    public RemittanceNotFoundException(String entityType, UUID entityId) {
        super(entityType + " not found: " + entityId);
        this.entityType = entityType;
        this.entityId = entityId;
    }

    public String getEntityType() {
        return entityType;
    }

    public UUID getEntityId() {
        return entityId;
    }

    @Override
    public ErrorCode getErrorCode() {
        return ErrorCode.NOT_FOUND;
    }
}
