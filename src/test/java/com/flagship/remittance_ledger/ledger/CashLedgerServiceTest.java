package com.flagship.remittance_ledger.ledger;

import com.flagship.remittance_ledger.audit.AuditAction;
import com.flagship.remittance_ledger.audit.AuditLogService;
import com.flagship.remittance_ledger.common.CurrencyCode;
import com.flagship.remittance_ledger.exception.RemittanceValidationException;
import com.flagship.remittance_ledger.remittance.CreateIncomingCommand;
import com.flagship.remittance_ledger.remittance.IncomingRemittance;
import com.flagship.remittance_ledger.remittance.RemittanceService;
import com.flagship.remittance_ledger.settlement.SettlementService;
import com.flagship.remittance_ledger.remittance.CreateOutgoingCommand;
import com.flagship.remittance_ledger.remittance.OutgoingRemittance;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Cash ledger postings, stored balances and their reconciliation.
 */
@SpringBootTest
@Testcontainers(disabledWithoutDocker = true)
class CashLedgerServiceTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16")
            .withDatabaseName("remittance_ledger_test")
            .withUsername("test")
            .withPassword("test");

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
        registry.add("spring.kafka.bootstrap-servers", () -> "localhost:9999");
        registry.add("spring.data.redis.port", () -> "6399");
        registry.add("outbox.publisher.enabled", () -> "false");
    }

    @Autowired
    private CashLedgerService cashLedgerService;

    @Autowired
    private RemittanceService remittanceService;

    @Autowired
    private SettlementService settlementService;

    @Autowired
    private AuditLogService auditLogService;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    private UUID tenantId;
    private UUID branchId;
    private UUID actorId;

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printOutput(String label, Object value) {
        System.out.println("OUTPUT - " + label + ": " + value);
    }

    private void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }

    @BeforeEach
    void setUp() {
        tenantId = UUID.randomUUID();
        branchId = UUID.randomUUID();
        actorId = UUID.randomUUID();
    }

    private OutgoingRemittance outgoing(String amount, String received) {
        return remittanceService.createOutgoing(CreateOutgoingCommand.builder()
            .tenantId(tenantId)
            .branchId(branchId)
            .actorId(actorId)
            .senderName("Sender")
            .senderPhone("+1-604-555-0133")
            .recipientName("Recipient")
            .currency(CurrencyCode.IRR)
            .amount(new BigDecimal(amount))
            .acquisitionRate(new BigDecimal("85000"))
            .fundingCurrency(CurrencyCode.CAD)
            .receivedAmount(new BigDecimal(received))
            .build());
    }

    private IncomingRemittance incoming(UUID branch, String amount) {
        return remittanceService.createIncoming(CreateIncomingCommand.builder()
            .tenantId(tenantId)
            .branchId(branch)
            .actorId(actorId)
            .senderName("Sender")
            .senderPhone("+98-21-555-0100")
            .recipientName("Recipient")
            .currency(CurrencyCode.IRR)
            .amount(new BigDecimal(amount))
            .payoutRate(new BigDecimal("86000"))
            .fundingCurrency(CurrencyCode.CAD)
            .build());
    }

    @Test
    @DisplayName("Creating remittances posts signed entries and keeps the stored balance in step")
    void testCreation_PostsEntries() {
        printTestHeader("Creation Postings");

        OutgoingRemittance o = outgoing("850000.00", "10.00");
        incoming(branchId, "300000.00");

        assertEquals(0, new BigDecimal("10.00").compareTo(cashLedgerService.getBalance(tenantId, branchId, CurrencyCode.CAD).getBalance()));
        assertEquals(0, new BigDecimal("-550000.00").compareTo(cashLedgerService.getBalance(tenantId, branchId, CurrencyCode.IRR).getBalance()));

        List<CashLedgerEntry> entries = cashLedgerService.getEntries(tenantId, branchId, CurrencyCode.IRR);
        assertEquals(List.of(CashEntryType.DEBT_OPENED, CashEntryType.FUNDS_RECEIVED),
            entries.stream().map(CashLedgerEntry::getEntryType).toList());
        assertTrue(entries.get(0).getSequenceNumber() < entries.get(1).getSequenceNumber());
        assertEquals(o.getId(), entries.get(0).getReferenceId());

        printSuccess("Entries and stored balances agree");
    }

    @Test
    @DisplayName("Settlement across branches moves the debt position between them")
    void testSettlement_AcrossBranches() {
        printTestHeader("Cross-Branch Settlement");

        UUID otherBranch = UUID.randomUUID();
        OutgoingRemittance o = outgoing("1000.00", "0");
        IncomingRemittance i = incoming(otherBranch, "1000.00");

        settlementService.settle(tenantId, o.getId(), i.getId(), new BigDecimal("400.00"), actorId, null);

        // outgoing branch holds -remaining debt, incoming branch holds remaining funds
        assertEquals(0, new BigDecimal("-600.00").compareTo(cashLedgerService.sumEntries(tenantId, branchId, CurrencyCode.IRR)));
        assertEquals(0, new BigDecimal("600.00").compareTo(cashLedgerService.sumEntries(tenantId, otherBranch, CurrencyCode.IRR)));
        assertEquals(0, cashLedgerService.getBalance(tenantId, branchId, CurrencyCode.CAD).getBalance().signum(),
            "Zero received amount posts nothing");
    }

    @Test
    @DisplayName("Refresh is idempotent and reports drift when the stored balance was tampered with")
    void testRefresh_DetectsDriftAndIsIdempotent() {
        printTestHeader("Balance Refresh");

        outgoing("1000.00", "12.00");

        BalanceReconciliation clean = cashLedgerService.refresh(tenantId, branchId, CurrencyCode.CAD);
        assertFalse(clean.hasDrift());

        jdbcTemplate.update("UPDATE cash_balances SET balance = balance + 5 WHERE tenant_id = ? AND branch_id = ? AND currency = ?",
            tenantId, branchId, CurrencyCode.CAD.name());

        BalanceReconciliation drifted = cashLedgerService.refresh(tenantId, branchId, CurrencyCode.CAD);
        printOutput("Drift", drifted.getDrift());
        assertTrue(drifted.hasDrift());
        assertEquals(0, new BigDecimal("5").compareTo(drifted.getDrift()));
        assertEquals(0, new BigDecimal("12.00").compareTo(drifted.getRecomputedBalance()));

        BalanceReconciliation again = cashLedgerService.refresh(tenantId, branchId, CurrencyCode.CAD);
        assertFalse(again.hasDrift());
        assertEquals(0, again.getStoredBalance().compareTo(again.getRecomputedBalance()));
        assertNotNull(cashLedgerService.getBalance(tenantId, branchId, CurrencyCode.CAD).getLastRecalculatedAt());

        printSuccess("Drift detected once, then corrected");
    }

    @Test
    @DisplayName("Refresh-all covers every branch and currency of the tenant")
    void testRefreshAll() {
        outgoing("1000.00", "12.00");
        incoming(UUID.randomUUID(), "500.00");

        List<BalanceReconciliation> results = cashLedgerService.refreshAll(tenantId);

        assertEquals(3, results.size(), "CAD and IRR at the outgoing branch, IRR at the incoming branch");
        assertTrue(results.stream().noneMatch(BalanceReconciliation::hasDrift));
    }

    @Test
    @DisplayName("Manual adjustments need a description and are audited")
    void testManualEntry() {
        printTestHeader("Manual Adjustment");

        CashLedgerEntry entry = cashLedgerService.recordManualEntry(tenantId, branchId, CurrencyCode.AED,
            new BigDecimal("-25.50"), actorId, "Counted short at end of day");

        assertEquals(CashEntryType.MANUAL_ADJUSTMENT, entry.getEntryType());
        assertEquals(0, new BigDecimal("-25.50").compareTo(cashLedgerService.getBalance(tenantId, branchId, CurrencyCode.AED).getBalance()));
        assertEquals(AuditAction.CASH_MANUAL_ADJUSTMENT,
            auditLogService.findByEntity(CashLedgerService.MANUAL_REFERENCE, entry.getId()).get(0).getAction());

        assertThrows(RemittanceValidationException.class, () -> cashLedgerService.recordManualEntry(
            tenantId, branchId, CurrencyCode.AED, new BigDecimal("1.00"), actorId, " "));
        assertThrows(RemittanceValidationException.class, () -> cashLedgerService.recordManualEntry(
            tenantId, branchId, CurrencyCode.AED, BigDecimal.ZERO, actorId, "nothing"));
    }

    @Test
    @DisplayName("Ledger entries cannot be updated or deleted")
    void testEntries_AppendOnly() {
        outgoing("1000.00", "12.00");

        assertThrows(DataAccessException.class, () -> jdbcTemplate.update(
            "UPDATE cash_ledger_entries SET amount = 1 WHERE tenant_id = ?", tenantId));
        assertThrows(DataAccessException.class, () -> jdbcTemplate.update(
            "DELETE FROM cash_ledger_entries WHERE tenant_id = ?", tenantId));
    }

    @Test
    @DisplayName("Unknown tuple reads as a zero balance")
    void testBalance_Unknown() {
        CashBalance balance = cashLedgerService.getBalance(tenantId, UUID.randomUUID(), CurrencyCode.GBP);
        assertEquals(0, balance.getBalance().signum());
        assertNull(balance.getLastRecalculatedAt());
    }
}
