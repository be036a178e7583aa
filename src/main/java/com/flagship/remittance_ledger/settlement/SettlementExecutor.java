package com.flagship.remittance_ledger.settlement;

import com.flagship.remittance_ledger.audit.AuditAction;
import com.flagship.remittance_ledger.audit.AuditLogService;
import com.flagship.remittance_ledger.exception.InsufficientFundsException;
import com.flagship.remittance_ledger.exception.RemittanceNotFoundException;
import com.flagship.remittance_ledger.exception.RemittanceValidationException;
import com.flagship.remittance_ledger.ledger.CashEntryType;
import com.flagship.remittance_ledger.ledger.CashLedgerService;
import com.flagship.remittance_ledger.ledger.CashMovement;
import com.flagship.remittance_ledger.outbox.OutboxService;
import com.flagship.remittance_ledger.remittance.IncomingRemittanceEntity;
import com.flagship.remittance_ledger.remittance.IncomingRemittanceRepository;
import com.flagship.remittance_ledger.remittance.OutgoingRemittanceEntity;
import com.flagship.remittance_ledger.remittance.OutgoingRemittanceRepository;
import com.flagship.remittance_ledger.settlement.event.SettlementCreatedEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * One settlement attempt in one transaction.
 *
 * Both rows are locked FOR UPDATE, outgoing first, then incoming. Every
 * settlement takes the locks in that order, so two settlements can wait on each
 * other but never deadlock. Callers go through {@link SettlementService}, which
 * retries this method on lock conflicts.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SettlementExecutor {

    private final OutgoingRemittanceRepository outgoingRepository;
    private final IncomingRemittanceRepository incomingRepository;
    private final SettlementRepository settlementRepository;
    private final CashLedgerService cashLedgerService;
    private final AuditLogService auditLogService;
    private final OutboxService outboxService;
    private final Clock clock;

    @Transactional
    public Settlement execute(SettleCommand command) {
        OutgoingRemittanceEntity outgoing = outgoingRepository.findForUpdate(command.getOutgoingId(), command.getTenantId())
            .orElseThrow(() -> new RemittanceNotFoundException(OutboxService.OUTGOING_AGGREGATE, command.getOutgoingId()));
        IncomingRemittanceEntity incoming = incomingRepository.findForUpdate(command.getIncomingId(), command.getTenantId())
            .orElseThrow(() -> new RemittanceNotFoundException(OutboxService.INCOMING_AGGREGATE, command.getIncomingId()));

        outgoing.ensureOpen();
        incoming.ensureOpen();

        if (outgoing.getCurrency() != incoming.getCurrency()) {
            throw new RemittanceValidationException("Currency mismatch: outgoing " + outgoing.getRemittanceCode()
                + " is " + outgoing.getCurrency() + ", incoming " + incoming.getRemittanceCode() + " is " + incoming.getCurrency());
        }

        BigDecimal amount = command.getAmount();
        BigDecimal available = outgoing.getRemainingAmount().min(incoming.getRemainingAmount());
        if (amount.compareTo(available) > 0) {
            throw new InsufficientFundsException(amount, available);
        }

        BigDecimal profit = ProfitCalculator.profit(amount, outgoing.getAcquisitionRate(), incoming.getPayoutRate());
        Instant now = clock.instant();

        outgoing.applySettlement(amount, profit, now);
        incoming.applyAllocation(amount, now);

        Settlement settlement = Settlement.builder()
            .id(UUID.randomUUID())
            .tenantId(command.getTenantId())
            .outgoingRemittanceId(outgoing.getId())
            .incomingRemittanceId(incoming.getId())
            .settledAmount(amount)
            .acquisitionRate(outgoing.getAcquisitionRate())
            .payoutRate(incoming.getPayoutRate())
            .profit(profit)
            .notes(command.getNotes())
            .createdBy(command.getActorId())
            .createdAt(now)
            .build();
        settlementRepository.save(SettlementEntity.fromDomain(settlement));

        cashLedgerService.post(CashMovement.builder()
            .tenantId(command.getTenantId())
            .branchId(outgoing.getBranchId())
            .currency(outgoing.getCurrency())
            .amount(amount)
            .entryType(CashEntryType.SETTLEMENT_DEBT_RELIEF)
            .referenceType(OutboxService.SETTLEMENT_AGGREGATE)
            .referenceId(settlement.getId())
            .description("Debt of " + outgoing.getRemittanceCode() + " settled from " + incoming.getRemittanceCode())
            .createdBy(command.getActorId())
            .build());
        cashLedgerService.post(CashMovement.builder()
            .tenantId(command.getTenantId())
            .branchId(incoming.getBranchId())
            .currency(incoming.getCurrency())
            .amount(amount.negate())
            .entryType(CashEntryType.SETTLEMENT_FUNDS_CONSUMED)
            .referenceType(OutboxService.SETTLEMENT_AGGREGATE)
            .referenceId(settlement.getId())
            .description("Funds of " + incoming.getRemittanceCode() + " used for " + outgoing.getRemittanceCode())
            .createdBy(command.getActorId())
            .build());

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("outgoingId", outgoing.getId());
        details.put("incomingId", incoming.getId());
        details.put("amount", amount);
        details.put("profit", profit);
        details.put("outgoingStatus", outgoing.getStatus());
        details.put("incomingStatus", incoming.getStatus());
        auditLogService.record(command.getTenantId(), command.getActorId(), AuditAction.SETTLEMENT_CREATED,
            OutboxService.SETTLEMENT_AGGREGATE, settlement.getId(), details);

        outboxService.saveEvent(OutboxService.SETTLEMENT_AGGREGATE, settlement.getId(), SettlementCreatedEvent.EVENT_TYPE,
            SettlementCreatedEvent.of(settlement, outgoing.getCurrency(), outgoing.getStatus(), incoming.getStatus()));

        log.debug("Settled {} {} between {} ({}) and {} ({}), profit {}",
            amount.toPlainString(), outgoing.getCurrency(),
            outgoing.getRemittanceCode(), outgoing.getStatus(),
            incoming.getRemittanceCode(), incoming.getStatus(), profit.toPlainString());
        return settlement;
    }
}
