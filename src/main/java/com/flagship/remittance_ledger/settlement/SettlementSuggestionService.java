package com.flagship.remittance_ledger.settlement;

import com.flagship.remittance_ledger.exception.InvalidRemittanceStateException;
import com.flagship.remittance_ledger.remittance.OutgoingRemittance;
import com.flagship.remittance_ledger.remittance.RemittanceService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;

/**
 * Read-only suggestions for settling one outgoing debt. Takes no locks, so the
 * result may be stale by the time it is acted on.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SettlementSuggestionService {

    private final RemittanceService remittanceService;

    @Transactional(readOnly = true)
    public List<SettlementSuggestion> suggestSettlements(UUID tenantId, UUID outgoingId,
                                                         SettlementStrategy strategy, int limit) {
        OutgoingRemittance outgoing = remittanceService.getOutgoing(tenantId, outgoingId);
        if (outgoing.getStatus().isTerminal()) {
            throw new InvalidRemittanceStateException(outgoingId,
                "Outgoing remittance " + outgoing.getRemittanceCode() + " is " + outgoing.getStatus()
                    + " and has nothing left to settle");
        }

        List<SettlementCandidate> candidates = remittanceService
            .findSettlementCandidates(tenantId, outgoing.getCurrency())
            .stream()
            .map(SettlementCandidate::of)
            .toList();

        List<SettlementSuggestion> suggestions = StrategySelector.plan(
            strategy,
            outgoing.getRemainingAmount(),
            outgoing.getAcquisitionRate(),
            StrategySelector.order(candidates, strategy, outgoing.getAcquisitionRate()),
            limit);

        log.debug("{} suggestions for {} using {} from {} candidates",
            suggestions.size(), outgoing.getRemittanceCode(), strategy, candidates.size());
        return suggestions;
    }
}
