package com.flagship.remittance_ledger.settlement;

import com.flagship.remittance_ledger.common.Amounts;
import com.flagship.remittance_ledger.exception.RemittanceLedgerException;
import com.flagship.remittance_ledger.exception.RemittanceValidationException;
import com.flagship.remittance_ledger.exception.SettlementConflictException;
import com.flagship.remittance_ledger.observability.CorrelationContext;
import com.flagship.remittance_ledger.observability.SettlementMetrics;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.List;
import java.util.UUID;

/**
 * Entry point for settling an outgoing debt against incoming funds.
 *
 * Each call is one transaction in {@link SettlementExecutor}. Lock timeouts,
 * deadlocks and version clashes are retried with backoff; once attempts run out
 * the call fails with {@link SettlementConflictException} and nothing is committed.
 * No amount is ever clamped: asking for more than is open fails.
 */
@Service
@Slf4j
public class SettlementService {

    private final SettlementExecutor executor;
    private final SettlementRepository settlementRepository;
    private final RetryTemplate retryTemplate;
    private final SettlementMetrics metrics;

    public SettlementService(SettlementExecutor executor,
                             SettlementRepository settlementRepository,
                             @Qualifier("settlementRetryTemplate") RetryTemplate retryTemplate,
                             SettlementMetrics metrics) {
        this.executor = executor;
        this.settlementRepository = settlementRepository;
        this.retryTemplate = retryTemplate;
        this.metrics = metrics;
    }

    public Settlement settle(UUID tenantId, UUID outgoingId, UUID incomingId,
                             BigDecimal amount, UUID actorId, String notes) {
        if (tenantId == null || outgoingId == null || incomingId == null) {
            throw new RemittanceValidationException("tenantId, outgoingId and incomingId are required");
        }
        if (actorId == null) {
            throw new RemittanceValidationException("actorId is required");
        }
        SettleCommand command = SettleCommand.builder()
            .tenantId(tenantId)
            .outgoingId(outgoingId)
            .incomingId(incomingId)
            .amount(Amounts.requireAmount(amount, "amount"))
            .actorId(actorId)
            .notes(notes)
            .build();

        String previousOutgoing = MDC.get(CorrelationContext.OUTGOING_ID_MDC_KEY);
        MDC.put(CorrelationContext.OUTGOING_ID_MDC_KEY, outgoingId.toString());
        MDC.put(CorrelationContext.INCOMING_ID_MDC_KEY, incomingId.toString());
        long start = System.nanoTime();
        try {
            Settlement settlement = retryTemplate.execute(context -> {
                if (context.getRetryCount() > 0) {
                    metrics.incrementRetries();
                    log.warn("Retrying settlement after lock conflict (attempt {}): {}",
                        context.getRetryCount() + 1, context.getLastThrowable().getMessage());
                }
                return executor.execute(command);
            });
            metrics.recordSettlementOutcome("success");
            log.info("Settlement {} created: amount={}, profit={}",
                settlement.getId(), settlement.getSettledAmount().toPlainString(), settlement.getProfit().toPlainString());
            return settlement;
        } catch (ConcurrencyFailureException e) {
            metrics.recordSettlementOutcome("conflict");
            log.warn("Settlement gave up after lock conflicts: {}", e.getMessage());
            throw new SettlementConflictException(
                "Settlement of " + outgoingId + " against " + incomingId + " conflicted with concurrent updates", e);
        } catch (RemittanceLedgerException e) {
            metrics.recordSettlementOutcome(e.getErrorCode().name());
            log.warn("Settlement rejected [{}]: {}", e.getErrorCode(), e.getMessage());
            throw e;
        } finally {
            metrics.recordSettlementDuration(Duration.ofNanos(System.nanoTime() - start));
            MDC.remove(CorrelationContext.INCOMING_ID_MDC_KEY);
            if (previousOutgoing != null) {
                MDC.put(CorrelationContext.OUTGOING_ID_MDC_KEY, previousOutgoing);
            } else {
                MDC.remove(CorrelationContext.OUTGOING_ID_MDC_KEY);
            }
        }
    }

    /**
     * Every settlement that touched the remittance, on either side, oldest first.
     */
    @Transactional(readOnly = true)
    public List<Settlement> settlementHistory(UUID tenantId, UUID remittanceId) {
        return settlementRepository.findHistory(tenantId, remittanceId).stream()
            .map(SettlementEntity::toDomain)
            .toList();
    }
}
