package com.flagship.remittance_ledger.ledger;

import com.flagship.remittance_ledger.audit.AuditAction;
import com.flagship.remittance_ledger.audit.AuditLogService;
import com.flagship.remittance_ledger.common.CurrencyCode;
import com.flagship.remittance_ledger.exception.RemittanceValidationException;
import com.flagship.remittance_ledger.observability.SettlementMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.sql.Timestamp;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Append-only cash ledger keyed by (tenant, branch, currency).
 *
 * Every post inserts one entry and bumps the stored balance in the same
 * transaction with {@code balance = balance + ?}, so concurrent posts never lose
 * an update. The stored balance is a cache: {@link #refresh} recomputes it from
 * the entries and reports any drift.
 *
 * Uses JDBC directly; entries are never read back through JPA.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CashLedgerService {

    public static final String MANUAL_REFERENCE = "ManualAdjustment";

    private final JdbcTemplate jdbcTemplate;
    private final AuditLogService auditLogService;
    private final SettlementMetrics metrics;
    private final Clock clock;

    /**
     * Posts a movement inside the caller's transaction.
     *
     * @return id of the new ledger entry
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public UUID post(CashMovement movement) {
        if (movement.getAmount() == null || movement.getAmount().signum() == 0) {
            throw new RemittanceValidationException("Cash movement amount must be non-zero");
        }
        UUID entryId = UUID.randomUUID();
        Timestamp now = Timestamp.from(clock.instant());

        jdbcTemplate.update(
            "INSERT INTO cash_ledger_entries (id, tenant_id, branch_id, currency, amount, entry_type, " +
            "reference_type, reference_id, description, created_by, created_at) " +
            "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)",
            entryId,
            movement.getTenantId(),
            movement.getBranchId(),
            movement.getCurrency().name(),
            movement.getAmount(),
            movement.getEntryType().name(),
            movement.getReferenceType(),
            movement.getReferenceId(),
            movement.getDescription(),
            movement.getCreatedBy(),
            now
        );

        ensureBalanceRow(movement.getTenantId(), movement.getBranchId(), movement.getCurrency());
        jdbcTemplate.update(
            "UPDATE cash_balances SET balance = balance + ?, updated_at = ? " +
            "WHERE tenant_id = ? AND branch_id = ? AND currency = ?",
            movement.getAmount(),
            now,
            movement.getTenantId(),
            movement.getBranchId(),
            movement.getCurrency().name()
        );

        log.debug("Posted {} {} {} at branch {} (ref {} {})",
                movement.getEntryType(), movement.getAmount().toPlainString(), movement.getCurrency(),
                movement.getBranchId(), movement.getReferenceType(), movement.getReferenceId());
        return entryId;
    }

    /**
     * Operator correction outside any remittance flow. Audited.
     */
    @Transactional
    public CashLedgerEntry recordManualEntry(UUID tenantId, UUID branchId, CurrencyCode currency,
                                             BigDecimal amount, UUID actorId, String description) {
        if (description == null || description.isBlank()) {
            throw new RemittanceValidationException("Manual adjustments require a description");
        }
        UUID entryId = post(CashMovement.builder()
                .tenantId(tenantId)
                .branchId(branchId)
                .currency(currency)
                .amount(amount)
                .entryType(CashEntryType.MANUAL_ADJUSTMENT)
                .referenceType(MANUAL_REFERENCE)
                .description(description)
                .createdBy(actorId)
                .build());

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("branchId", branchId);
        details.put("currency", currency);
        details.put("amount", amount);
        details.put("description", description);
        auditLogService.record(tenantId, actorId, AuditAction.CASH_MANUAL_ADJUSTMENT, MANUAL_REFERENCE, entryId, details);

        log.info("Manual cash adjustment {} {} at branch {}", amount.toPlainString(), currency, branchId);
        return jdbcTemplate.queryForObject(ENTRY_SELECT + "WHERE id = ?", entryRowMapper(), entryId);
    }

    @Transactional(readOnly = true)
    public CashBalance getBalance(UUID tenantId, UUID branchId, CurrencyCode currency) {
        List<CashBalance> rows = jdbcTemplate.query(
            "SELECT tenant_id, branch_id, currency, balance, last_recalculated_at, updated_at " +
            "FROM cash_balances WHERE tenant_id = ? AND branch_id = ? AND currency = ?",
            balanceRowMapper(),
            tenantId, branchId, currency.name()
        );
        return rows.isEmpty() ? CashBalance.empty(tenantId, branchId, currency) : rows.get(0);
    }

    @Transactional(readOnly = true)
    public BigDecimal sumEntries(UUID tenantId, UUID branchId, CurrencyCode currency) {
        BigDecimal sum = jdbcTemplate.queryForObject(
            "SELECT COALESCE(SUM(amount), 0) FROM cash_ledger_entries " +
            "WHERE tenant_id = ? AND branch_id = ? AND currency = ?",
            BigDecimal.class,
            tenantId, branchId, currency.name()
        );
        return sum != null ? sum : BigDecimal.ZERO;
    }

    @Transactional(readOnly = true)
    public List<CashLedgerEntry> getEntries(UUID tenantId, UUID branchId, CurrencyCode currency) {
        return jdbcTemplate.query(
            ENTRY_SELECT + "WHERE tenant_id = ? AND branch_id = ? AND currency = ? ORDER BY sequence_number",
            entryRowMapper(),
            tenantId, branchId, currency.name()
        );
    }

    @Transactional(readOnly = true)
    public List<CashLedgerEntry> getEntriesForReference(String referenceType, UUID referenceId) {
        return jdbcTemplate.query(
            ENTRY_SELECT + "WHERE reference_type = ? AND reference_id = ? ORDER BY sequence_number",
            entryRowMapper(),
            referenceType, referenceId
        );
    }

    /**
     * Recomputes the stored balance from the entries and overwrites it.
     * The balance row is locked first so concurrent posts queue behind the refresh.
     * Running it twice in a row reports zero drift the second time.
     */
    @Transactional
    public BalanceReconciliation refresh(UUID tenantId, UUID branchId, CurrencyCode currency) {
        ensureBalanceRow(tenantId, branchId, currency);

        BigDecimal stored = jdbcTemplate.queryForObject(
            "SELECT balance FROM cash_balances WHERE tenant_id = ? AND branch_id = ? AND currency = ? FOR UPDATE",
            BigDecimal.class,
            tenantId, branchId, currency.name()
        );
        BigDecimal recomputed = sumEntries(tenantId, branchId, currency);
        Instant now = clock.instant();

        jdbcTemplate.update(
            "UPDATE cash_balances SET balance = ?, last_recalculated_at = ?, updated_at = ? " +
            "WHERE tenant_id = ? AND branch_id = ? AND currency = ?",
            recomputed, Timestamp.from(now), Timestamp.from(now),
            tenantId, branchId, currency.name()
        );

        BalanceReconciliation result = new BalanceReconciliation(
            tenantId, branchId, currency, stored, recomputed, stored.subtract(recomputed), now);

        if (result.hasDrift()) {
            metrics.recordBalanceDrift(currency.name());
            log.warn("Cash balance drift at branch {} {}: stored={}, recomputed={}, drift={}",
                    branchId, currency, stored.toPlainString(), recomputed.toPlainString(),
                    result.getDrift().toPlainString());
        } else {
            log.debug("Cash balance at branch {} {} verified: {}", branchId, currency, recomputed.toPlainString());
        }
        return result;
    }

    /**
     * Refreshes every (branch, currency) the tenant has entries or a stored balance for.
     */
    @Transactional
    public List<BalanceReconciliation> refreshAll(UUID tenantId) {
        List<Map<String, Object>> tuples = jdbcTemplate.queryForList(
            "SELECT branch_id, currency FROM cash_ledger_entries WHERE tenant_id = ? " +
            "UNION SELECT branch_id, currency FROM cash_balances WHERE tenant_id = ? " +
            "ORDER BY 1, 2",
            tenantId, tenantId
        );
        List<BalanceReconciliation> results = tuples.stream()
            .map(row -> refresh(tenantId, (UUID) row.get("branch_id"), CurrencyCode.valueOf((String) row.get("currency"))))
            .toList();
        long drifted = results.stream().filter(BalanceReconciliation::hasDrift).count();
        log.info("Refreshed {} cash balances for tenant {}, {} with drift", results.size(), tenantId, drifted);
        return results;
    }

    private void ensureBalanceRow(UUID tenantId, UUID branchId, CurrencyCode currency) {
        jdbcTemplate.update(
            "INSERT INTO cash_balances (tenant_id, branch_id, currency, balance, updated_at) " +
            "VALUES (?, ?, ?, 0, ?) ON CONFLICT (tenant_id, branch_id, currency) DO NOTHING",
            tenantId, branchId, currency.name(), Timestamp.from(clock.instant())
        );
    }

    private static final String ENTRY_SELECT =
        "SELECT id, tenant_id, branch_id, currency, amount, entry_type, reference_type, reference_id, " +
        "description, created_by, created_at, sequence_number FROM cash_ledger_entries ";

    private static RowMapper<CashLedgerEntry> entryRowMapper() {
        return (rs, rowNum) -> new CashLedgerEntry(
            rs.getObject("id", UUID.class),
            rs.getObject("tenant_id", UUID.class),
            rs.getObject("branch_id", UUID.class),
            CurrencyCode.valueOf(rs.getString("currency")),
            rs.getBigDecimal("amount"),
            CashEntryType.valueOf(rs.getString("entry_type")),
            rs.getString("reference_type"),
            rs.getObject("reference_id", UUID.class),
            rs.getString("description"),
            rs.getObject("created_by", UUID.class),
            rs.getTimestamp("created_at").toInstant(),
            rs.getLong("sequence_number")
        );
    }

    private static RowMapper<CashBalance> balanceRowMapper() {
        return (rs, rowNum) -> {
            Timestamp recalculated = rs.getTimestamp("last_recalculated_at");
            return new CashBalance(
                rs.getObject("tenant_id", UUID.class),
                rs.getObject("branch_id", UUID.class),
                CurrencyCode.valueOf(rs.getString("currency")),
                rs.getBigDecimal("balance"),
                recalculated != null ? recalculated.toInstant() : null,
                rs.getTimestamp("updated_at").toInstant()
            );
        };
    }
}
