package com.flagship.remittance_ledger.audit;

public enum AuditAction {
    OUTGOING_CREATED,
    INCOMING_CREATED,
    OUTGOING_CANCELLED,
    INCOMING_CANCELLED,
    INCOMING_PAID,
    SETTLEMENT_CREATED,
    CASH_MANUAL_ADJUSTMENT
}
