package com.flagship.remittance_ledger.settlement;

import com.flagship.remittance_ledger.audit.AuditAction;
import com.flagship.remittance_ledger.audit.AuditLogEntry;
import com.flagship.remittance_ledger.audit.AuditLogService;
import com.flagship.remittance_ledger.common.CurrencyCode;
import com.flagship.remittance_ledger.exception.InsufficientFundsException;
import com.flagship.remittance_ledger.exception.InvalidRemittanceStateException;
import com.flagship.remittance_ledger.exception.RemittanceLedgerException;
import com.flagship.remittance_ledger.exception.RemittanceNotFoundException;
import com.flagship.remittance_ledger.exception.RemittanceValidationException;
import com.flagship.remittance_ledger.ledger.CashLedgerService;
import com.flagship.remittance_ledger.outbox.OutboxEvent;
import com.flagship.remittance_ledger.outbox.OutboxService;
import com.flagship.remittance_ledger.remittance.CreateIncomingCommand;
import com.flagship.remittance_ledger.remittance.CreateOutgoingCommand;
import com.flagship.remittance_ledger.remittance.IncomingRemittance;
import com.flagship.remittance_ledger.remittance.OutgoingRemittance;
import com.flagship.remittance_ledger.remittance.RemittanceService;
import com.flagship.remittance_ledger.remittance.RemittanceStatus;
import com.flagship.remittance_ledger.settlement.event.SettlementCreatedEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Settlement primitive, suggestions and auto-settle against a real PostgreSQL.
 *
 * Settlements and ledger entries are append-only, so every test works in its own
 * random tenant instead of cleaning tables.
 */
@SpringBootTest
@Testcontainers(disabledWithoutDocker = true)
class SettlementServiceTest {

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
        // No Kafka or Redis here: outbox rows stay unpublished, idempotency falls back to the database
        registry.add("spring.kafka.bootstrap-servers", () -> "localhost:9999");
        registry.add("spring.data.redis.port", () -> "6399");
        registry.add("outbox.publisher.enabled", () -> "false");
    }

    @Autowired
    private SettlementService settlementService;

    @Autowired
    private SettlementSuggestionService suggestionService;

    @Autowired
    private AutoSettlementService autoSettlementService;

    @Autowired
    private RemittanceService remittanceService;

    @Autowired
    private CashLedgerService cashLedgerService;

    @Autowired
    private AuditLogService auditLogService;

    @Autowired
    private OutboxService outboxService;

    @Autowired
    private SettlementRepository settlementRepository;

    private UUID tenantId;
    private UUID branchId;
    private UUID actorId;

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printInput(String label, Object value) {
        System.out.println("INPUT  - " + label + ": " + value);
    }

    private void printOutput(String label, Object value) {
        System.out.println("OUTPUT - " + label + ": " + value);
    }

    private void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }

    private void printExpectedException(String exceptionType, String reason) {
        System.out.println("⚠ EXPECTED EXCEPTION: " + exceptionType);
        System.out.println("  Reason: " + reason);
    }

    @BeforeEach
    void setUp() {
        tenantId = UUID.randomUUID();
        branchId = UUID.randomUUID();
        actorId = UUID.randomUUID();
        printInput("Tenant ID", tenantId);
    }

    private OutgoingRemittance outgoing(String amount, String acquisitionRate) {
        return outgoing(amount, acquisitionRate, CurrencyCode.IRR);
    }

    private OutgoingRemittance outgoing(String amount, String acquisitionRate, CurrencyCode currency) {
        BigDecimal face = new BigDecimal(amount);
        BigDecimal rate = new BigDecimal(acquisitionRate);
        return remittanceService.createOutgoing(CreateOutgoingCommand.builder()
            .tenantId(tenantId)
            .branchId(branchId)
            .actorId(actorId)
            .senderName("Reza Ahmadi")
            .senderPhone("+1-416-555-0101")
            .recipientName("Maryam Karimi")
            .currency(currency)
            .amount(face)
            .acquisitionRate(rate)
            .fundingCurrency(CurrencyCode.CAD)
            .receivedAmount(face.divide(rate, 2, RoundingMode.HALF_UP))
            .build());
    }

    private IncomingRemittance incoming(String amount, String payoutRate) {
        return incoming(amount, payoutRate, CurrencyCode.IRR);
    }

    private IncomingRemittance incoming(String amount, String payoutRate, CurrencyCode currency) {
        return remittanceService.createIncoming(CreateIncomingCommand.builder()
            .tenantId(tenantId)
            .branchId(branchId)
            .actorId(actorId)
            .senderName("Ali Rahimi")
            .senderPhone("+98-21-555-0199")
            .recipientName("Sara Moradi")
            .currency(currency)
            .amount(new BigDecimal(amount))
            .payoutRate(new BigDecimal(payoutRate))
            .fundingCurrency(CurrencyCode.CAD)
            .build());
    }

    private void assertBalanced(OutgoingRemittance o) {
        assertEquals(0, o.getSettledAmount().add(o.getRemainingAmount()).compareTo(o.getAmount()),
            "settled + remaining must equal amount for " + o.getRemittanceCode());
        assertEquals(0, o.getSettledAmount().compareTo(settlementRepository.sumSettledForOutgoing(o.getId())),
            "settled amount must equal the sum of its settlements");
    }

    private void assertBalanced(IncomingRemittance i) {
        assertEquals(0, i.getAllocatedAmount().add(i.getRemainingAmount()).compareTo(i.getAmount()),
            "allocated + remaining must equal amount for " + i.getRemittanceCode());
        assertEquals(0, i.getAllocatedAmount().compareTo(settlementRepository.sumSettledForIncoming(i.getId())),
            "allocated amount must equal the sum of its settlements");
    }

    /**
     * Debt-currency ledger position must mirror the open balances of the registers.
     */
    private void assertLedgerMatchesRegisters(CurrencyCode currency) {
        BigDecimal incomingOpen = remittanceService.listIncoming(tenantId, EnumSet.complementOf(
                EnumSet.of(RemittanceStatus.CANCELLED))).stream()
            .filter(i -> i.getCurrency() == currency)
            .map(IncomingRemittance::getRemainingAmount)
            .reduce(BigDecimal.ZERO, BigDecimal::add);
        BigDecimal outgoingOpen = remittanceService.listOutgoing(tenantId, EnumSet.complementOf(
                EnumSet.of(RemittanceStatus.CANCELLED))).stream()
            .filter(o -> o.getCurrency() == currency)
            .map(OutgoingRemittance::getRemainingAmount)
            .reduce(BigDecimal.ZERO, BigDecimal::add);

        BigDecimal ledgerSum = cashLedgerService.sumEntries(tenantId, branchId, currency);
        BigDecimal storedBalance = cashLedgerService.getBalance(tenantId, branchId, currency).getBalance();

        printOutput("Ledger sum", ledgerSum);
        printOutput("Incoming open - outgoing open", incomingOpen.subtract(outgoingOpen));
        assertEquals(0, ledgerSum.compareTo(incomingOpen.subtract(outgoingOpen)));
        assertEquals(0, storedBalance.compareTo(ledgerSum), "Stored balance must equal the sum of entries");
    }

    @Test
    @DisplayName("BEST_RATE auto-settle takes the widest spread first")
    void testAutoSettle_BestRateScenario() {
        printTestHeader("Auto-Settle BEST_RATE Scenario");

        OutgoingRemittance o1 = outgoing("1000000.00", "85000");
        IncomingRemittance i1 = incoming("400000.00", "84000");
        IncomingRemittance i2 = incoming("700000.00", "86000");

        List<SettlementSuggestion> suggestions =
            suggestionService.suggestSettlements(tenantId, o1.getId(), SettlementStrategy.BEST_RATE, 0);
        printOutput("Suggestions", suggestions);
        assertEquals(2, suggestions.size());
        assertEquals(i2.getId(), suggestions.get(0).getIncomingId());
        assertEquals(0, new BigDecimal("700000").compareTo(suggestions.get(0).getSuggestedAmount()));
        assertEquals(i1.getId(), suggestions.get(1).getIncomingId());
        assertEquals(0, new BigDecimal("300000").compareTo(suggestions.get(1).getSuggestedAmount()));

        AutoSettleResult result = autoSettlementService.autoSettle(tenantId, o1.getId(), actorId, SettlementStrategy.BEST_RATE);
        printOutput("Outcome", result.getOutcome());

        assertEquals(AutoSettleOutcome.ALL_SETTLED, result.getOutcome());
        assertEquals(2, result.getSettlements().size());
        assertEquals(i2.getId(), result.getSettlements().get(0).getIncomingRemittanceId());
        assertEquals(i1.getId(), result.getSettlements().get(1).getIncomingRemittanceId());

        OutgoingRemittance o1After = remittanceService.getOutgoing(tenantId, o1.getId());
        IncomingRemittance i1After = remittanceService.getIncoming(tenantId, i1.getId());
        IncomingRemittance i2After = remittanceService.getIncoming(tenantId, i2.getId());

        assertEquals(RemittanceStatus.COMPLETED, o1After.getStatus());
        assertNotNull(o1After.getCompletedAt());
        assertEquals(RemittanceStatus.PARTIAL, i1After.getStatus());
        assertEquals(0, new BigDecimal("100000").compareTo(i1After.getRemainingAmount()));
        assertEquals(RemittanceStatus.COMPLETED, i2After.getStatus());
        assertEquals(0, result.getTotalProfit().compareTo(o1After.getTotalProfit()));
        assertBalanced(o1After);
        assertBalanced(i1After);
        assertBalanced(i2After);
        assertLedgerMatchesRegisters(CurrencyCode.IRR);

        printSuccess("I2 consumed first, O1 completed, I1 left PARTIAL with 100,000");
    }

    @Test
    @DisplayName("Settle writes the settlement, audit row, outbox event and ledger entries")
    void testSettle_RecordsEverything() {
        printTestHeader("Settle - Side Effects");

        OutgoingRemittance o = outgoing("1000.00", "85000");
        IncomingRemittance i = incoming("600.00", "86000");

        Settlement settlement = settlementService.settle(tenantId, o.getId(), i.getId(),
            new BigDecimal("250.00"), actorId, "manual match");
        printOutput("Settlement", settlement);

        assertEquals(new BigDecimal("250.00"), settlement.getSettledAmount());
        assertEquals(ProfitCalculator.profit(new BigDecimal("250.00"), new BigDecimal("85000"), new BigDecimal("86000")),
            settlement.getProfit());

        OutgoingRemittance oAfter = remittanceService.getOutgoing(tenantId, o.getId());
        IncomingRemittance iAfter = remittanceService.getIncoming(tenantId, i.getId());
        assertEquals(RemittanceStatus.PARTIAL, oAfter.getStatus());
        assertEquals(RemittanceStatus.PARTIAL, iAfter.getStatus());
        assertEquals(0, new BigDecimal("750.00").compareTo(oAfter.getRemainingAmount()));
        assertEquals(0, new BigDecimal("350.00").compareTo(iAfter.getRemainingAmount()));

        List<Settlement> history = settlementService.settlementHistory(tenantId, i.getId());
        assertEquals(1, history.size());
        assertEquals(settlement.getId(), history.get(0).getId());
        assertEquals(history, settlementService.settlementHistory(tenantId, o.getId()));

        List<AuditLogEntry> audit = auditLogService.findByEntity(OutboxService.SETTLEMENT_AGGREGATE, settlement.getId());
        assertEquals(1, audit.size());
        assertEquals(AuditAction.SETTLEMENT_CREATED, audit.get(0).getAction());
        assertEquals(actorId, audit.get(0).getActorId());

        List<OutboxEvent> events = outboxService.getEventsForAggregate(OutboxService.SETTLEMENT_AGGREGATE, settlement.getId());
        assertEquals(1, events.size());
        assertEquals(SettlementCreatedEvent.EVENT_TYPE, events.get(0).getEventType());
        assertFalse(events.get(0).isPublished());

        assertEquals(2, cashLedgerService.getEntriesForReference(OutboxService.SETTLEMENT_AGGREGATE, settlement.getId()).size());
        assertLedgerMatchesRegisters(CurrencyCode.IRR);

        printSuccess("Settlement recorded atomically with its side effects");
    }

    @Test
    @DisplayName("Settling the final remainder flips to COMPLETED once; further settles fail")
    void testSettle_CompletesExactlyOnce() {
        printTestHeader("Settle - COMPLETED Flip");

        OutgoingRemittance o = outgoing("500.00", "85000");
        IncomingRemittance i1 = incoming("300.00", "86000");
        IncomingRemittance i2 = incoming("300.00", "86000");

        settlementService.settle(tenantId, o.getId(), i1.getId(), new BigDecimal("300.00"), actorId, null);
        settlementService.settle(tenantId, o.getId(), i2.getId(), new BigDecimal("200.00"), actorId, null);

        OutgoingRemittance completed = remittanceService.getOutgoing(tenantId, o.getId());
        assertEquals(RemittanceStatus.COMPLETED, completed.getStatus());
        assertEquals(0, completed.getRemainingAmount().signum());

        InvalidRemittanceStateException e = assertThrows(InvalidRemittanceStateException.class,
            () -> settlementService.settle(tenantId, o.getId(), i2.getId(), new BigDecimal("1.00"), actorId, null));
        printExpectedException("InvalidRemittanceStateException", e.getMessage());
        assertEquals(o.getId(), e.getRemittanceId());

        assertThrows(InvalidRemittanceStateException.class,
            () -> suggestionService.suggestSettlements(tenantId, o.getId(), SettlementStrategy.FIFO, 0));
        assertEquals(completed.getCompletedAt(), remittanceService.getOutgoing(tenantId, o.getId()).getCompletedAt());

        printSuccess("Terminal remittances reject further settlement");
    }

    @Test
    @DisplayName("Requests beyond what is open are rejected, never clamped")
    void testSettle_Validation() {
        printTestHeader("Settle - Validation");

        OutgoingRemittance o = outgoing("1000.00", "85000");
        IncomingRemittance i = incoming("400.00", "86000");
        IncomingRemittance usd = incoming("400.00", "1.35", CurrencyCode.USD);

        assertThrows(InsufficientFundsException.class,
            () -> settlementService.settle(tenantId, o.getId(), i.getId(), new BigDecimal("400.01"), actorId, null));
        assertThrows(RemittanceValidationException.class,
            () -> settlementService.settle(tenantId, o.getId(), i.getId(), BigDecimal.ZERO, actorId, null));
        assertThrows(RemittanceValidationException.class,
            () -> settlementService.settle(tenantId, o.getId(), i.getId(), new BigDecimal("-5.00"), actorId, null));
        assertThrows(RemittanceValidationException.class,
            () -> settlementService.settle(tenantId, o.getId(), i.getId(), new BigDecimal("1.005"), actorId, null));
        assertThrows(RemittanceValidationException.class,
            () -> settlementService.settle(tenantId, o.getId(), usd.getId(), new BigDecimal("1.00"), actorId, null),
            "Debt currencies must match");
        assertThrows(RemittanceNotFoundException.class,
            () -> settlementService.settle(tenantId, o.getId(), UUID.randomUUID(), new BigDecimal("1.00"), actorId, null));
        assertThrows(RemittanceNotFoundException.class,
            () -> settlementService.settle(UUID.randomUUID(), o.getId(), i.getId(), new BigDecimal("1.00"), actorId, null),
            "Records of another tenant are invisible");

        assertEquals(RemittanceStatus.PENDING, remittanceService.getOutgoing(tenantId, o.getId()).getStatus());
        assertEquals(0, new BigDecimal("400.00").compareTo(remittanceService.getIncoming(tenantId, i.getId()).getRemainingAmount()));
        assertTrue(settlementService.settlementHistory(tenantId, o.getId()).isEmpty());

        printSuccess("Every invalid request left both registers untouched");
    }

    @Test
    @DisplayName("Suggestions only consider open incoming funds in the same currency")
    void testSuggestions_FilterCandidates() {
        printTestHeader("Suggestions - Candidate Filter");

        OutgoingRemittance o = outgoing("1000.00", "85000");
        IncomingRemittance open = incoming("100.00", "86000");
        incoming("100.00", "1.35", CurrencyCode.USD);
        IncomingRemittance cancelled = incoming("100.00", "86000");
        remittanceService.cancelIncoming(tenantId, cancelled.getId(), actorId, "duplicate entry");

        List<SettlementSuggestion> suggestions =
            suggestionService.suggestSettlements(tenantId, o.getId(), SettlementStrategy.FIFO, 0);

        assertEquals(1, suggestions.size());
        assertEquals(open.getId(), suggestions.get(0).getIncomingId());
        assertLedgerMatchesRegisters(CurrencyCode.IRR);
    }

    @Test
    @DisplayName("Cancelling an outgoing after any settlement fails")
    void testCancel_AfterSettlementRejected() {
        printTestHeader("Cancel After Settlement");

        OutgoingRemittance o = outgoing("1000.00", "85000");
        IncomingRemittance i = incoming("1000.00", "86000");
        settlementService.settle(tenantId, o.getId(), i.getId(), new BigDecimal("0.01"), actorId, null);

        InvalidRemittanceStateException e = assertThrows(InvalidRemittanceStateException.class,
            () -> remittanceService.cancelOutgoing(tenantId, o.getId(), actorId, "customer changed mind"));
        printExpectedException("InvalidRemittanceStateException", e.getMessage());
        assertThrows(InvalidRemittanceStateException.class,
            () -> remittanceService.cancelIncoming(tenantId, i.getId(), actorId, "customer changed mind"));

        OutgoingRemittance untouched = outgoing("50.00", "85000");
        OutgoingRemittance cancelled = remittanceService.cancelOutgoing(tenantId, untouched.getId(), actorId, "typo");
        assertEquals(RemittanceStatus.CANCELLED, cancelled.getStatus());
        assertLedgerMatchesRegisters(CurrencyCode.IRR);
        assertEquals(0, cashLedgerService.sumEntries(tenantId, branchId, CurrencyCode.CAD)
            .compareTo(o.getReceivedAmount()), "Refund of the cancelled outgoing nets its cash receipt to zero");

        printSuccess("Only untouched remittances can be cancelled");
    }

    @Test
    @DisplayName("Concurrent settlements never consume more than the incoming holds")
    void testConcurrentSettlements_NoOverAllocation() throws Exception {
        printTestHeader("Concurrent Settlements");

        IncomingRemittance shared = incoming("1000.00", "86000");
        List<OutgoingRemittance> debts = new ArrayList<>();
        for (int n = 0; n < 10; n++) {
            debts.add(outgoing("200.00", "85000"));
        }
        printInput("Requested in total", "10 x 200.00 against 1000.00");

        ExecutorService executor = Executors.newFixedThreadPool(10);
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger successes = new AtomicInteger();
        AtomicInteger rejections = new AtomicInteger();
        List<Throwable> unexpected = Collections.synchronizedList(new ArrayList<>());

        for (OutgoingRemittance debt : debts) {
            executor.submit(() -> {
                try {
                    start.await();
                    settlementService.settle(tenantId, debt.getId(), shared.getId(), new BigDecimal("200.00"), actorId, null);
                    successes.incrementAndGet();
                } catch (InsufficientFundsException | InvalidRemittanceStateException e) {
                    rejections.incrementAndGet();
                } catch (RemittanceLedgerException e) {
                    unexpected.add(e);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return null;
            });
        }
        start.countDown();
        executor.shutdown();
        assertTrue(executor.awaitTermination(60, TimeUnit.SECONDS));

        printOutput("Successes", successes.get());
        printOutput("Rejections", rejections.get());
        assertTrue(unexpected.isEmpty(), "Unexpected failures: " + unexpected);
        assertEquals(5, successes.get());
        assertEquals(5, rejections.get());

        IncomingRemittance after = remittanceService.getIncoming(tenantId, shared.getId());
        assertEquals(RemittanceStatus.COMPLETED, after.getStatus());
        assertEquals(0, after.getRemainingAmount().signum());
        BigDecimal settledTotal = settlementService.settlementHistory(tenantId, shared.getId()).stream()
            .map(Settlement::getSettledAmount)
            .reduce(BigDecimal.ZERO, BigDecimal::add);
        assertEquals(0, new BigDecimal("1000.00").compareTo(settledTotal));
        assertBalanced(after);
        assertLedgerMatchesRegisters(CurrencyCode.IRR);

        printSuccess("Exactly 1000.00 allocated across concurrent requests");
    }
}
