package com.flagship.remittance_ledger.audit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.remittance_ledger.observability.CorrelationContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.sql.Timestamp;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Append-only audit trail. Every mutating engine operation writes exactly one row
 * in the same transaction as the change itself.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AuditLogService {

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Transactional(propagation = Propagation.MANDATORY)
    public void record(UUID tenantId, UUID actorId, AuditAction action,
                       String entityType, UUID entityId, Map<String, ?> details) {
        jdbcTemplate.update(
            "INSERT INTO audit_log (tenant_id, actor_id, action, entity_type, entity_id, details, correlation_id, created_at) " +
            "VALUES (?, ?, ?, ?, ?, ?::jsonb, ?, ?)",
            tenantId,
            actorId,
            action.name(),
            entityType,
            entityId,
            toJson(details),
            MDC.get(CorrelationContext.CORRELATION_ID_MDC_KEY),
            Timestamp.from(clock.instant())
        );
        log.debug("Audit {} on {} {}", action, entityType, entityId);
    }

    @Transactional(readOnly = true)
    public List<AuditLogEntry> findByEntity(String entityType, UUID entityId) {
        return jdbcTemplate.query(
            "SELECT id, tenant_id, actor_id, action, entity_type, entity_id, details::text AS details, correlation_id, created_at " +
            "FROM audit_log WHERE entity_type = ? AND entity_id = ? ORDER BY id",
            auditRowMapper(),
            entityType,
            entityId
        );
    }

    private String toJson(Map<String, ?> details) {
        if (details == null || details.isEmpty()) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(details);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize audit details", e);
        }
    }

    private static RowMapper<AuditLogEntry> auditRowMapper() {
        return (rs, rowNum) -> new AuditLogEntry(
            rs.getLong("id"),
            rs.getObject("tenant_id", UUID.class),
            rs.getObject("actor_id", UUID.class),
            AuditAction.valueOf(rs.getString("action")),
            rs.getString("entity_type"),
            rs.getObject("entity_id", UUID.class),
            rs.getString("details"),
            rs.getString("correlation_id"),
            rs.getTimestamp("created_at").toInstant()
        );
    }
}
