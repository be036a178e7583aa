package com.flagship.remittance_ledger.settlement;

import com.flagship.remittance_ledger.exception.InsufficientFundsException;
import com.flagship.remittance_ledger.exception.InvalidRemittanceStateException;
import com.flagship.remittance_ledger.exception.RemittanceLedgerException;
import com.flagship.remittance_ledger.exception.RemittanceNotFoundException;
import com.flagship.remittance_ledger.exception.SettlementConflictException;
import com.flagship.remittance_ledger.observability.SettlementMetrics;
import com.flagship.remittance_ledger.remittance.OutgoingRemittance;
import com.flagship.remittance_ledger.remittance.RemittanceService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Settles an outgoing debt against as many incoming funds as the strategy finds.
 *
 * Not transactional: every settlement commits on its own, so a run
 * that stops halfway leaves consistent state and can be started again.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AutoSettlementService {

    private final SettlementSuggestionService suggestionService;
    private final SettlementService settlementService;
    private final RemittanceService remittanceService;
    private final SettlementMetrics metrics;

    public AutoSettleResult autoSettle(UUID tenantId, UUID outgoingId, UUID actorId, SettlementStrategy strategy) {
        List<SettlementSuggestion> suggestions = suggestionService.suggestSettlements(tenantId, outgoingId, strategy, 0);
        log.info("Auto-settling outgoing {} with {} over {} suggestions", outgoingId, strategy, suggestions.size());

        List<Settlement> created = new ArrayList<>();
        List<SkippedCandidate> skipped = new ArrayList<>();
        BigDecimal totalSettled = BigDecimal.ZERO;
        BigDecimal totalProfit = BigDecimal.ZERO;

        for (SettlementSuggestion suggestion : suggestions) {
            try {
                Settlement settlement = settlementService.settle(tenantId, outgoingId, suggestion.getIncomingId(),
                    suggestion.getSuggestedAmount(), actorId, "auto-settle " + strategy);
                created.add(settlement);
                totalSettled = totalSettled.add(settlement.getSettledAmount());
                totalProfit = totalProfit.add(settlement.getProfit());
            } catch (InvalidRemittanceStateException e) {
                if (outgoingId.equals(e.getRemittanceId())) {
                    log.info("Stopping auto-settle of {}: {}", outgoingId, e.getMessage());
                    break;
                }
                skipped.add(skip(suggestion, e));
            } catch (RemittanceNotFoundException e) {
                if (outgoingId.equals(e.getEntityId())) {
                    throw e;
                }
                skipped.add(skip(suggestion, e));
            } catch (InsufficientFundsException | SettlementConflictException e) {
                skipped.add(skip(suggestion, e));
            }
        }

        OutgoingRemittance outgoing = remittanceService.getOutgoing(tenantId, outgoingId);
        AutoSettleOutcome outcome = AutoSettleOutcome.of(created.size(), outgoing.getRemainingAmount().signum() == 0);
        metrics.recordAutoSettle(strategy.name(), outcome.name());

        log.info("Auto-settle of {} finished: outcome={}, settlements={}, skipped={}, settled={}, remaining={}",
            outgoing.getRemittanceCode(), outcome, created.size(), skipped.size(),
            totalSettled.toPlainString(), outgoing.getRemainingAmount().toPlainString());

        return AutoSettleResult.builder()
            .outgoingId(outgoingId)
            .strategy(strategy)
            .outcome(outcome)
            .totalSettled(totalSettled)
            .totalProfit(totalProfit)
            .outgoingStatus(outgoing.getStatus())
            .outgoingRemaining(outgoing.getRemainingAmount())
            .settlements(List.copyOf(created))
            .skipped(List.copyOf(skipped))
            .build();
    }

    private static SkippedCandidate skip(SettlementSuggestion suggestion, RemittanceLedgerException e) {
        log.warn("Skipping incoming {} during auto-settle: {}", suggestion.getIncomingCode(), e.getMessage());
        return new SkippedCandidate(suggestion.getIncomingId(), suggestion.getIncomingCode(),
            suggestion.getSuggestedAmount(), e.getErrorCode(), e.getMessage());
    }
}
