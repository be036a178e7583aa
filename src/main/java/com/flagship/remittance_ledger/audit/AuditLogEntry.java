package com.flagship.remittance_ledger.audit;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
public class AuditLogEntry {
    long id;
    UUID tenantId;
    UUID actorId;
    AuditAction action;
    String entityType;
    UUID entityId;
    String details;            // JSON
    String correlationId;
    Instant createdAt;
}
