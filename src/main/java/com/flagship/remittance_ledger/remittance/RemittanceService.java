package com.flagship.remittance_ledger.remittance;

import com.flagship.remittance_ledger.audit.AuditAction;
import com.flagship.remittance_ledger.audit.AuditLogService;
import com.flagship.remittance_ledger.common.Amounts;
import com.flagship.remittance_ledger.common.CurrencyCode;
import com.flagship.remittance_ledger.exception.RemittanceNotFoundException;
import com.flagship.remittance_ledger.exception.RemittanceValidationException;
import com.flagship.remittance_ledger.ledger.CashEntryType;
import com.flagship.remittance_ledger.ledger.CashLedgerService;
import com.flagship.remittance_ledger.ledger.CashMovement;
import com.flagship.remittance_ledger.observability.CorrelationContext;
import com.flagship.remittance_ledger.observability.SettlementMetrics;
import com.flagship.remittance_ledger.outbox.OutboxService;
import com.flagship.remittance_ledger.remittance.event.RemittanceCancelledEvent;
import com.flagship.remittance_ledger.remittance.event.RemittanceCreatedEvent;
import com.flagship.remittance_ledger.remittance.event.RemittancePaidEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Instant;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Outgoing and incoming registers: creation, payout, cancellation and lookups.
 *
 * Every mutation writes its cash ledger entries, one audit row and one outbox
 * event in the same transaction as the register change. Balances are never
 * touched here; that is the settlement primitive's job.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RemittanceService {

    private static final EnumSet<RemittanceStatus> UNSETTLED = EnumSet.of(RemittanceStatus.PENDING, RemittanceStatus.PARTIAL);

    private final OutgoingRemittanceRepository outgoingRepository;
    private final IncomingRemittanceRepository incomingRepository;
    private final RemittanceIdempotencyService idempotencyService;
    private final RemittanceCodes remittanceCodes;
    private final CashLedgerService cashLedgerService;
    private final AuditLogService auditLogService;
    private final OutboxService outboxService;
    private final SettlementMetrics metrics;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;

    // ==================== Creation ====================

    /**
     * Registers an outbound transfer. A repeated idempotency key returns the
     * remittance created the first time, unchanged, also when both requests race.
     */
    public OutgoingRemittance createOutgoing(CreateOutgoingCommand command) {
        requireIdentity(command.getTenantId(), command.getBranchId(), command.getActorId());

        String key = normalizeKey(command.getIdempotencyKey());
        try {
            return transactionTemplate.execute(status -> insertOutgoing(command, key));
        } catch (DataIntegrityViolationException e) {
            UUID existing = findByKeyAfterConflict(RemittanceDirection.OUTGOING, command.getTenantId(), key, e);
            return getOutgoing(command.getTenantId(), existing);
        }
    }

    private OutgoingRemittance insertOutgoing(CreateOutgoingCommand command, String key) {
        if (key != null) {
            Optional<UUID> existing = idempotencyService.lookup(RemittanceDirection.OUTGOING, command.getTenantId(), key);
            if (existing.isPresent()) {
                metrics.recordIdempotencyHit();
                log.info("Duplicate outgoing creation for key {}, returning {}", key, existing.get());
                return getOutgoing(command.getTenantId(), existing.get());
            }
            metrics.recordIdempotencyMiss();
        }

        requireText(command.getSenderName(), "senderName");
        requireText(command.getSenderPhone(), "senderPhone");
        requireText(command.getRecipientName(), "recipientName");
        requireCurrency(command.getCurrency(), "currency");
        requireCurrency(command.getFundingCurrency(), "fundingCurrency");

        BigDecimal amount = Amounts.requireAmount(command.getAmount(), "amount");
        BigDecimal rate = Amounts.requireRate(command.getAcquisitionRate(), "acquisitionRate");
        BigDecimal received = Amounts.nonNegativeOrZero(command.getReceivedAmount(), "receivedAmount");
        BigDecimal fee = Amounts.nonNegativeOrZero(command.getFee(), "fee");
        Instant now = clock.instant();

        OutgoingRemittance draft = OutgoingRemittance.builder()
            .id(UUID.randomUUID())
            .tenantId(command.getTenantId())
            .branchId(command.getBranchId())
            .remittanceCode(remittanceCodes.nextOutgoing())
            .senderName(command.getSenderName())
            .senderPhone(command.getSenderPhone())
            .senderEmail(command.getSenderEmail())
            .recipientName(command.getRecipientName())
            .recipientPhone(command.getRecipientPhone())
            .recipientIban(command.getRecipientIban())
            .recipientBank(command.getRecipientBank())
            .recipientAddress(command.getRecipientAddress())
            .currency(command.getCurrency())
            .amount(amount)
            .acquisitionRate(rate)
            .fundingCurrency(command.getFundingCurrency())
            .receivedAmount(received)
            .fee(fee)
            .totalCost(amount.divide(rate, MathContext.DECIMAL128).setScale(6, RoundingMode.HALF_EVEN))
            .notes(command.getNotes())
            .createdBy(command.getActorId())
            .createdAt(now)
            .build();

        OutgoingRemittance saved = outgoingRepository.saveAndFlush(OutgoingRemittanceEntity.fromDomain(draft, key)).toDomain();

        if (received.signum() > 0) {
            cashLedgerService.post(outgoingMovement(saved, saved.getFundingCurrency(), received,
                CashEntryType.CASH_RECEIVED, "Cash received for " + saved.getRemittanceCode(), saved.getCreatedBy()));
        }
        cashLedgerService.post(outgoingMovement(saved, saved.getCurrency(), amount.negate(),
            CashEntryType.DEBT_OPENED, "Debt opened by " + saved.getRemittanceCode(), saved.getCreatedBy()));

        auditLogService.record(saved.getTenantId(), saved.getCreatedBy(), AuditAction.OUTGOING_CREATED,
            OutboxService.OUTGOING_AGGREGATE, saved.getId(), createdDetails(saved.getRemittanceCode(), saved.getCurrency().name(),
                amount, rate, saved.getFundingCurrency().name()));
        outboxService.saveEvent(OutboxService.OUTGOING_AGGREGATE, saved.getId(),
            RemittanceCreatedEvent.EVENT_TYPE, RemittanceCreatedEvent.fromOutgoing(saved));

        if (key != null) {
            idempotencyService.rememberAfterCommit(RemittanceDirection.OUTGOING, saved.getTenantId(), key, saved.getId());
        }
        metrics.recordRemittanceCreated(RemittanceDirection.OUTGOING.name(), saved.getCurrency().name());
        log.info("Created outgoing remittance {} ({}): {} {} at {}", saved.getRemittanceCode(), saved.getId(),
            amount.toPlainString(), saved.getCurrency(), rate.toPlainString());
        return saved;
    }

    public IncomingRemittance createIncoming(CreateIncomingCommand command) {
        requireIdentity(command.getTenantId(), command.getBranchId(), command.getActorId());

        String key = normalizeKey(command.getIdempotencyKey());
        try {
            return transactionTemplate.execute(status -> insertIncoming(command, key));
        } catch (DataIntegrityViolationException e) {
            UUID existing = findByKeyAfterConflict(RemittanceDirection.INCOMING, command.getTenantId(), key, e);
            return getIncoming(command.getTenantId(), existing);
        }
    }

    private IncomingRemittance insertIncoming(CreateIncomingCommand command, String key) {
        if (key != null) {
            Optional<UUID> existing = idempotencyService.lookup(RemittanceDirection.INCOMING, command.getTenantId(), key);
            if (existing.isPresent()) {
                metrics.recordIdempotencyHit();
                log.info("Duplicate incoming creation for key {}, returning {}", key, existing.get());
                return getIncoming(command.getTenantId(), existing.get());
            }
            metrics.recordIdempotencyMiss();
        }

        requireText(command.getSenderName(), "senderName");
        requireText(command.getSenderPhone(), "senderPhone");
        requireText(command.getRecipientName(), "recipientName");
        requireCurrency(command.getCurrency(), "currency");
        requireCurrency(command.getFundingCurrency(), "fundingCurrency");

        BigDecimal amount = Amounts.requireAmount(command.getAmount(), "amount");
        BigDecimal rate = Amounts.requireRate(command.getPayoutRate(), "payoutRate");
        BigDecimal fee = Amounts.nonNegativeOrZero(command.getFee(), "fee");
        Instant now = clock.instant();

        IncomingRemittance draft = IncomingRemittance.builder()
            .id(UUID.randomUUID())
            .tenantId(command.getTenantId())
            .branchId(command.getBranchId())
            .remittanceCode(remittanceCodes.nextIncoming())
            .senderName(command.getSenderName())
            .senderPhone(command.getSenderPhone())
            .senderIban(command.getSenderIban())
            .senderBank(command.getSenderBank())
            .recipientName(command.getRecipientName())
            .recipientPhone(command.getRecipientPhone())
            .recipientEmail(command.getRecipientEmail())
            .recipientAddress(command.getRecipientAddress())
            .currency(command.getCurrency())
            .amount(amount)
            .payoutRate(rate)
            .fundingCurrency(command.getFundingCurrency())
            .payoutAmount(amount.divide(rate, MathContext.DECIMAL128).setScale(Amounts.AMOUNT_SCALE, RoundingMode.HALF_EVEN))
            .fee(fee)
            .notes(command.getNotes())
            .createdBy(command.getActorId())
            .createdAt(now)
            .build();

        IncomingRemittance saved = incomingRepository.saveAndFlush(IncomingRemittanceEntity.fromDomain(draft, key)).toDomain();

        cashLedgerService.post(incomingMovement(saved, saved.getCurrency(), amount,
            CashEntryType.FUNDS_RECEIVED, "Funds received by " + saved.getRemittanceCode(), saved.getCreatedBy()));

        auditLogService.record(saved.getTenantId(), saved.getCreatedBy(), AuditAction.INCOMING_CREATED,
            OutboxService.INCOMING_AGGREGATE, saved.getId(), createdDetails(saved.getRemittanceCode(), saved.getCurrency().name(),
                amount, rate, saved.getFundingCurrency().name()));
        outboxService.saveEvent(OutboxService.INCOMING_AGGREGATE, saved.getId(),
            RemittanceCreatedEvent.EVENT_TYPE, RemittanceCreatedEvent.fromIncoming(saved));

        if (key != null) {
            idempotencyService.rememberAfterCommit(RemittanceDirection.INCOMING, saved.getTenantId(), key, saved.getId());
        }
        metrics.recordRemittanceCreated(RemittanceDirection.INCOMING.name(), saved.getCurrency().name());
        log.info("Created incoming remittance {} ({}): {} {} at {}", saved.getRemittanceCode(), saved.getId(),
            amount.toPlainString(), saved.getCurrency(), rate.toPlainString());
        return saved;
    }

    // ==================== Lifecycle ====================

    /**
     * Cancels an outgoing remittance nothing has been settled against yet.
     * Takes the same row lock as settlement, so the two serialize.
     */
    @Transactional
    public OutgoingRemittance cancelOutgoing(UUID tenantId, UUID outgoingId, UUID actorId, String reason) {
        requireActor(actorId);
        MDC.put(CorrelationContext.OUTGOING_ID_MDC_KEY, outgoingId.toString());
        try {
            OutgoingRemittanceEntity entity = outgoingRepository.findForUpdate(outgoingId, tenantId)
                .orElseThrow(() -> new RemittanceNotFoundException(OutboxService.OUTGOING_AGGREGATE, outgoingId));
            Instant now = clock.instant();
            entity.cancel(actorId, reason, now);
            OutgoingRemittance cancelled = entity.toDomain();

            if (cancelled.getReceivedAmount().signum() > 0) {
                cashLedgerService.post(outgoingMovement(cancelled, cancelled.getFundingCurrency(),
                    cancelled.getReceivedAmount().negate(), CashEntryType.CASH_REFUNDED,
                    "Refund for cancelled " + cancelled.getRemittanceCode(), actorId));
            }
            cashLedgerService.post(outgoingMovement(cancelled, cancelled.getCurrency(), cancelled.getAmount(),
                CashEntryType.DEBT_CANCELLED, "Debt closed by cancelling " + cancelled.getRemittanceCode(), actorId));

            auditLogService.record(tenantId, actorId, AuditAction.OUTGOING_CANCELLED, OutboxService.OUTGOING_AGGREGATE,
                outgoingId, reasonDetails(cancelled.getRemittanceCode(), reason));
            outboxService.saveEvent(OutboxService.OUTGOING_AGGREGATE, outgoingId, RemittanceCancelledEvent.EVENT_TYPE,
                new RemittanceCancelledEvent(UUID.randomUUID(), tenantId, outgoingId, cancelled.getRemittanceCode(),
                    RemittanceDirection.OUTGOING, actorId, reason, now));

            log.info("Cancelled outgoing remittance {}: {}", cancelled.getRemittanceCode(), reason);
            return cancelled;
        } finally {
            MDC.remove(CorrelationContext.OUTGOING_ID_MDC_KEY);
        }
    }

    @Transactional
    public IncomingRemittance cancelIncoming(UUID tenantId, UUID incomingId, UUID actorId, String reason) {
        requireActor(actorId);
        MDC.put(CorrelationContext.INCOMING_ID_MDC_KEY, incomingId.toString());
        try {
            IncomingRemittanceEntity entity = incomingRepository.findForUpdate(incomingId, tenantId)
                .orElseThrow(() -> new RemittanceNotFoundException(OutboxService.INCOMING_AGGREGATE, incomingId));
            Instant now = clock.instant();
            entity.cancel(actorId, reason, now);
            IncomingRemittance cancelled = entity.toDomain();

            cashLedgerService.post(incomingMovement(cancelled, cancelled.getCurrency(), cancelled.getAmount().negate(),
                CashEntryType.FUNDS_RETURNED, "Funds withdrawn by cancelling " + cancelled.getRemittanceCode(), actorId));

            auditLogService.record(tenantId, actorId, AuditAction.INCOMING_CANCELLED, OutboxService.INCOMING_AGGREGATE,
                incomingId, reasonDetails(cancelled.getRemittanceCode(), reason));
            outboxService.saveEvent(OutboxService.INCOMING_AGGREGATE, incomingId, RemittanceCancelledEvent.EVENT_TYPE,
                new RemittanceCancelledEvent(UUID.randomUUID(), tenantId, incomingId, cancelled.getRemittanceCode(),
                    RemittanceDirection.INCOMING, actorId, reason, now));

            log.info("Cancelled incoming remittance {}: {}", cancelled.getRemittanceCode(), reason);
            return cancelled;
        } finally {
            MDC.remove(CorrelationContext.INCOMING_ID_MDC_KEY);
        }
    }

    /**
     * Records that the recipient of a fully settled incoming remittance was paid
     * {@code payoutAmount} in the funding currency.
     */
    @Transactional
    public IncomingRemittance markIncomingPaid(UUID tenantId, UUID incomingId, UUID actorId,
                                               String paymentMethod, String paymentReference) {
        requireActor(actorId);
        requireText(paymentMethod, "paymentMethod");
        MDC.put(CorrelationContext.INCOMING_ID_MDC_KEY, incomingId.toString());
        try {
            IncomingRemittanceEntity entity = incomingRepository.findForUpdate(incomingId, tenantId)
                .orElseThrow(() -> new RemittanceNotFoundException(OutboxService.INCOMING_AGGREGATE, incomingId));
            entity.markPaid(actorId, paymentMethod, paymentReference, clock.instant());
            IncomingRemittance paid = entity.toDomain();

            if (paid.getPaidAmount().signum() > 0) {
                cashLedgerService.post(incomingMovement(paid, paid.getFundingCurrency(), paid.getPaidAmount().negate(),
                    CashEntryType.CASH_PAID_OUT, "Payout of " + paid.getRemittanceCode(), actorId));
            }

            Map<String, Object> details = new LinkedHashMap<>();
            details.put("remittanceCode", paid.getRemittanceCode());
            details.put("paidAmount", paid.getPaidAmount());
            details.put("currency", paid.getFundingCurrency());
            details.put("paymentMethod", paymentMethod);
            details.put("paymentReference", paymentReference);
            auditLogService.record(tenantId, actorId, AuditAction.INCOMING_PAID, OutboxService.INCOMING_AGGREGATE,
                incomingId, details);
            outboxService.saveEvent(OutboxService.INCOMING_AGGREGATE, incomingId, RemittancePaidEvent.EVENT_TYPE,
                RemittancePaidEvent.fromIncoming(paid));

            log.info("Incoming remittance {} paid out: {} {} via {}", paid.getRemittanceCode(),
                paid.getPaidAmount().toPlainString(), paid.getFundingCurrency(), paymentMethod);
            return paid;
        } finally {
            MDC.remove(CorrelationContext.INCOMING_ID_MDC_KEY);
        }
    }

    // ==================== Queries ====================

    @Transactional(readOnly = true)
    public OutgoingRemittance getOutgoing(UUID tenantId, UUID outgoingId) {
        return outgoingRepository.findByIdAndTenantId(outgoingId, tenantId)
            .map(OutgoingRemittanceEntity::toDomain)
            .orElseThrow(() -> new RemittanceNotFoundException(OutboxService.OUTGOING_AGGREGATE, outgoingId));
    }

    @Transactional(readOnly = true)
    public IncomingRemittance getIncoming(UUID tenantId, UUID incomingId) {
        return incomingRepository.findByIdAndTenantId(incomingId, tenantId)
            .map(IncomingRemittanceEntity::toDomain)
            .orElseThrow(() -> new RemittanceNotFoundException(OutboxService.INCOMING_AGGREGATE, incomingId));
    }

    /**
     * PENDING and PARTIAL outgoing remittances, oldest first.
     */
    @Transactional(readOnly = true)
    public List<OutgoingRemittance> listUnsettledOutgoing(UUID tenantId) {
        return listOutgoing(tenantId, UNSETTLED);
    }

    @Transactional(readOnly = true)
    public List<IncomingRemittance> listUnsettledIncoming(UUID tenantId) {
        return listIncoming(tenantId, UNSETTLED);
    }

    @Transactional(readOnly = true)
    public List<OutgoingRemittance> listOutgoing(UUID tenantId, EnumSet<RemittanceStatus> statuses) {
        return listOutgoing(tenantId, null, statuses);
    }

    /**
     * Outgoing remittances in the given statuses, oldest first. A null branch lists every branch.
     */
    @Transactional(readOnly = true)
    public List<OutgoingRemittance> listOutgoing(UUID tenantId, UUID branchId, EnumSet<RemittanceStatus> statuses) {
        if (statuses.isEmpty()) {
            return List.of();
        }
        List<OutgoingRemittanceEntity> rows = branchId == null
            ? outgoingRepository.findByTenantIdAndStatusInOrderByCreatedAtAscIdAsc(tenantId, statuses)
            : outgoingRepository.findByTenantIdAndBranchIdAndStatusInOrderByCreatedAtAscIdAsc(tenantId, branchId, statuses);
        return rows.stream()
            .map(OutgoingRemittanceEntity::toDomain)
            .toList();
    }

    @Transactional(readOnly = true)
    public List<IncomingRemittance> listIncoming(UUID tenantId, EnumSet<RemittanceStatus> statuses) {
        return listIncoming(tenantId, null, statuses);
    }

    @Transactional(readOnly = true)
    public List<IncomingRemittance> listIncoming(UUID tenantId, UUID branchId, EnumSet<RemittanceStatus> statuses) {
        if (statuses.isEmpty()) {
            return List.of();
        }
        List<IncomingRemittanceEntity> rows = branchId == null
            ? incomingRepository.findByTenantIdAndStatusInOrderByCreatedAtAscIdAsc(tenantId, statuses)
            : incomingRepository.findByTenantIdAndBranchIdAndStatusInOrderByCreatedAtAscIdAsc(tenantId, branchId, statuses);
        return rows.stream()
            .map(IncomingRemittanceEntity::toDomain)
            .toList();
    }

    /**
     * Open incoming funds in the given debt currency, unordered and unlocked.
     */
    @Transactional(readOnly = true)
    public List<IncomingRemittance> findSettlementCandidates(UUID tenantId, CurrencyCode currency) {
        return incomingRepository.findSettlementCandidates(tenantId, currency).stream()
            .map(IncomingRemittanceEntity::toDomain)
            .toList();
    }

    // ==================== Helpers ====================

    /**
     * A concurrent request with the same key committed first. Postgres holds the
     * losing insert until then, so the winner's row is visible here.
     */
    private UUID findByKeyAfterConflict(RemittanceDirection direction, UUID tenantId, String key,
                                        DataIntegrityViolationException conflict) {
        if (key == null) {
            throw conflict;
        }
        UUID existing = idempotencyService.lookup(direction, tenantId, key).orElseThrow(() -> conflict);
        metrics.recordIdempotencyHit();
        log.info("Concurrent {} creation for key {} lost the race, returning {}",
            direction.name().toLowerCase(Locale.ROOT), key, existing);
        return existing;
    }

    private static CashMovement outgoingMovement(OutgoingRemittance o, CurrencyCode currency,
                                                 BigDecimal amount, CashEntryType type, String description, UUID actorId) {
        return CashMovement.builder()
            .tenantId(o.getTenantId())
            .branchId(o.getBranchId())
            .currency(currency)
            .amount(amount)
            .entryType(type)
            .referenceType(OutboxService.OUTGOING_AGGREGATE)
            .referenceId(o.getId())
            .description(description)
            .createdBy(actorId)
            .build();
    }

    private static CashMovement incomingMovement(IncomingRemittance i, CurrencyCode currency,
                                                 BigDecimal amount, CashEntryType type, String description, UUID actorId) {
        return CashMovement.builder()
            .tenantId(i.getTenantId())
            .branchId(i.getBranchId())
            .currency(currency)
            .amount(amount)
            .entryType(type)
            .referenceType(OutboxService.INCOMING_AGGREGATE)
            .referenceId(i.getId())
            .description(description)
            .createdBy(actorId)
            .build();
    }

    private static Map<String, Object> createdDetails(String code, String currency, BigDecimal amount,
                                                      BigDecimal rate, String fundingCurrency) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("remittanceCode", code);
        details.put("currency", currency);
        details.put("amount", amount);
        details.put("rate", rate);
        details.put("fundingCurrency", fundingCurrency);
        return details;
    }

    private static Map<String, Object> reasonDetails(String code, String reason) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("remittanceCode", code);
        details.put("reason", reason);
        return details;
    }

    private static void requireIdentity(UUID tenantId, UUID branchId, UUID actorId) {
        if (tenantId == null) {
            throw new RemittanceValidationException("tenantId is required");
        }
        if (branchId == null) {
            throw new RemittanceValidationException("branchId is required");
        }
        requireActor(actorId);
    }

    private static void requireActor(UUID actorId) {
        if (actorId == null) {
            throw new RemittanceValidationException("actorId is required");
        }
    }

    private static void requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new RemittanceValidationException(field + " is required");
        }
    }

    private static void requireCurrency(CurrencyCode currency, String field) {
        if (currency == null) {
            throw new RemittanceValidationException(field + " is required");
        }
    }

    private static String normalizeKey(String idempotencyKey) {
        return idempotencyKey == null || idempotencyKey.isBlank() ? null : idempotencyKey.trim();
    }
}
