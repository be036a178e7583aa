package com.flagship.remittance_ledger.settlement;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Pure ordering and greedy planning over settlement candidates. No I/O.
 */
public final class StrategySelector {

    private static final Comparator<SettlementCandidate> OLDEST_FIRST =
        Comparator.comparing(SettlementCandidate::getCreatedAt)
            .thenComparing(SettlementCandidate::getIncomingId);

    private StrategySelector() {
    }

    /**
     * Returns a new list ordered by the strategy. The input is left untouched.
     *
     * @param acquisitionRate rate of the outgoing debt, needed for BEST_RATE margins
     */
    public static List<SettlementCandidate> order(List<SettlementCandidate> candidates,
                                                  SettlementStrategy strategy,
                                                  BigDecimal acquisitionRate) {
        List<SettlementCandidate> ordered = new ArrayList<>(candidates);
        ordered.sort(comparator(strategy, acquisitionRate));
        return ordered;
    }

    static Comparator<SettlementCandidate> comparator(SettlementStrategy strategy, BigDecimal acquisitionRate) {
        return switch (strategy) {
            case FIFO -> OLDEST_FIRST;
            case LIFO -> Comparator.comparing(SettlementCandidate::getCreatedAt, Comparator.reverseOrder())
                .thenComparing(SettlementCandidate::getIncomingId);
            case BEST_RATE -> Comparator.comparing(
                    (SettlementCandidate c) -> ProfitCalculator.marginPerUnit(acquisitionRate, c.getPayoutRate()),
                    Comparator.reverseOrder())
                .thenComparing(OLDEST_FIRST);
        };
    }

    /**
     * Walks the ordered candidates, suggesting {@code min(outgoing left, incoming remaining)}
     * each, until the debt is covered, candidates run out or {@code limit} is reached.
     *
     * @param limit maximum number of suggestions; {@code <= 0} means unlimited
     */
    public static List<SettlementSuggestion> plan(SettlementStrategy strategy,
                                                  BigDecimal outgoingRemaining,
                                                  BigDecimal acquisitionRate,
                                                  List<SettlementCandidate> ordered,
                                                  int limit) {
        List<SettlementSuggestion> suggestions = new ArrayList<>();
        BigDecimal left = outgoingRemaining;

        for (SettlementCandidate candidate : ordered) {
            if (left.signum() <= 0 || (limit > 0 && suggestions.size() >= limit)) {
                break;
            }
            if (candidate.getRemainingAmount().signum() <= 0) {
                continue;
            }
            BigDecimal amount = left.min(candidate.getRemainingAmount());
            BigDecimal profit = ProfitCalculator.profit(amount, acquisitionRate, candidate.getPayoutRate());
            suggestions.add(new SettlementSuggestion(
                candidate.getIncomingId(),
                candidate.getIncomingCode(),
                amount,
                profit,
                candidate.getPayoutRate(),
                candidate.getRemainingAmount(),
                candidate.getCreatedAt(),
                reason(strategy, candidate, suggestions.size() + 1, profit, amount.compareTo(left) == 0)
            ));
            left = left.subtract(amount);
        }
        return suggestions;
    }

    static String reason(SettlementStrategy strategy, SettlementCandidate candidate, int rank,
                         BigDecimal profit, boolean coversRest) {
        LocalDate received = LocalDate.ofInstant(candidate.getCreatedAt(), ZoneOffset.UTC);
        String basis = switch (strategy) {
            case FIFO -> "Oldest open funds first, received " + received;
            case LIFO -> "Newest open funds first, received " + received;
            case BEST_RATE -> "Rate margin rank " + rank + ", payout rate " + candidate.getPayoutRate().toPlainString()
                + ", expected profit " + profit.toPlainString();
        };
        return basis + (coversRest ? "; covers the remaining debt" : "; partial cover");
    }
}
