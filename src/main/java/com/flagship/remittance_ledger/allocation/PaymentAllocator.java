package com.flagship.remittance_ledger.allocation;

import com.flagship.remittance_ledger.common.Amounts;
import com.flagship.remittance_ledger.exception.RemittanceValidationException;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Spreads one payment over several open items. Pure; nothing is persisted.
 *
 * Ordered modes walk the items taking {@code min(left, item.remaining)} each,
 * the same clamp the settlement primitive uses. PROPORTIONAL rounds each share
 * down to cents and hands the leftover cents out one at a time, oldest item first.
 */
public final class PaymentAllocator {

    private static final BigDecimal CENT = new BigDecimal("0.01");

    private static final Comparator<OpenItem> OLDEST_FIRST =
        Comparator.comparing(OpenItem::getCreatedAt).thenComparing(OpenItem::getId);

    private PaymentAllocator() {
    }

    public static AllocationPlan allocate(List<OpenItem> items, BigDecimal totalAmount, AllocationMode mode) {
        BigDecimal total = Amounts.requireAmount(totalAmount, "totalAmount");
        if (items == null || items.isEmpty()) {
            throw new RemittanceValidationException("At least one open item is required");
        }
        List<OpenItem> ordered = new ArrayList<>(items.size());
        for (OpenItem item : items) {
            ordered.add(normalize(item, mode));
        }
        ordered.sort(comparator(mode));

        List<BigDecimal> shares = mode == AllocationMode.PROPORTIONAL
            ? proportionalShares(ordered, total)
            : sequentialShares(ordered, total);

        List<Allocation> allocations = new ArrayList<>(ordered.size());
        BigDecimal allocated = BigDecimal.ZERO.setScale(Amounts.AMOUNT_SCALE);
        for (int i = 0; i < ordered.size(); i++) {
            OpenItem item = ordered.get(i);
            allocations.add(new Allocation(item.getId(), item.getRemaining(), shares.get(i)));
            allocated = allocated.add(shares.get(i));
        }
        return new AllocationPlan(mode, total, List.copyOf(allocations), allocated, total.subtract(allocated));
    }

    static Comparator<OpenItem> comparator(AllocationMode mode) {
        return switch (mode) {
            case FIFO, PROPORTIONAL -> OLDEST_FIRST;
            case LIFO -> Comparator.comparing(OpenItem::getCreatedAt, Comparator.reverseOrder())
                .thenComparing(OpenItem::getId);
            case BEST_RATE -> Comparator.comparing(OpenItem::getRate, Comparator.reverseOrder())
                .thenComparing(OLDEST_FIRST);
        };
    }

    private static List<BigDecimal> sequentialShares(List<OpenItem> ordered, BigDecimal total) {
        List<BigDecimal> shares = new ArrayList<>(ordered.size());
        BigDecimal left = total;
        for (OpenItem item : ordered) {
            BigDecimal share = left.min(item.getRemaining());
            shares.add(share);
            left = left.subtract(share);
        }
        return shares;
    }

    private static List<BigDecimal> proportionalShares(List<OpenItem> ordered, BigDecimal total) {
        BigDecimal sumRemaining = ordered.stream()
            .map(OpenItem::getRemaining)
            .reduce(BigDecimal.ZERO, BigDecimal::add);
        BigDecimal distributable = total.min(sumRemaining);

        List<BigDecimal> shares = new ArrayList<>(ordered.size());
        BigDecimal handedOut = BigDecimal.ZERO;
        for (OpenItem item : ordered) {
            BigDecimal share = total.multiply(item.getRemaining())
                .divide(sumRemaining, Amounts.AMOUNT_SCALE, RoundingMode.DOWN)
                .min(item.getRemaining());
            shares.add(share);
            handedOut = handedOut.add(share);
        }

        BigDecimal leftover = distributable.subtract(handedOut);
        while (leftover.signum() > 0) {
            boolean progressed = false;
            for (int i = 0; i < ordered.size() && leftover.signum() > 0; i++) {
                if (shares.get(i).compareTo(ordered.get(i).getRemaining()) < 0) {
                    shares.set(i, shares.get(i).add(CENT));
                    leftover = leftover.subtract(CENT);
                    progressed = true;
                }
            }
            if (!progressed) {
                break;
            }
        }
        return shares;
    }

    private static OpenItem normalize(OpenItem item, AllocationMode mode) {
        if (item == null || item.getId() == null || item.getCreatedAt() == null) {
            throw new RemittanceValidationException("Open items need an id and createdAt");
        }
        BigDecimal remaining = Amounts.requireAmount(item.getRemaining(), "remaining of item " + item.getId());
        if (mode == AllocationMode.BEST_RATE) {
            Amounts.requirePositive(item.getRate(), "rate of item " + item.getId());
        }
        return new OpenItem(item.getId(), item.getCreatedAt(), remaining, item.getRate());
    }
}
