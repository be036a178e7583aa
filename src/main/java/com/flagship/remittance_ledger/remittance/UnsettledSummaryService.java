package com.flagship.remittance_ledger.remittance;

import com.flagship.remittance_ledger.common.CurrencyCode;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

@Service
@RequiredArgsConstructor
public class UnsettledSummaryService {

    /** Upper bound in days (inclusive) per bucket; the last bucket is open-ended. */
    private static final long[] AGE_LIMITS = {7, 14, 30};
    private static final String[] AGE_LABELS = {"0-7", "8-14", "15-30", "30+"};

    private final RemittanceService remittanceService;
    private final Clock clock;

    @Transactional(readOnly = true)
    public UnsettledSummary unsettledSummary(UUID tenantId) {
        Instant now = clock.instant();
        List<OutgoingRemittance> open = remittanceService.listUnsettledOutgoing(tenantId);

        Map<CurrencyCode, BigDecimal> total = new EnumMap<>(CurrencyCode.class);
        Map<RemittanceStatus, Accumulator> byStatus = new EnumMap<>(RemittanceStatus.class);
        List<Accumulator> byAge = new ArrayList<>();
        for (int i = 0; i < AGE_LABELS.length; i++) {
            byAge.add(new Accumulator());
        }

        for (OutgoingRemittance o : open) {
            total.merge(o.getCurrency(), o.getRemainingAmount(), BigDecimal::add);
            byStatus.computeIfAbsent(o.getStatus(), s -> new Accumulator()).add(o);
            byAge.get(ageBucket(o.getCreatedAt(), now)).add(o);
        }

        Map<RemittanceStatus, UnsettledSummary.Bucket> statusBuckets = new LinkedHashMap<>();
        byStatus.forEach((status, acc) -> statusBuckets.put(status, new UnsettledSummary.Bucket(acc.count, acc.remaining)));

        List<UnsettledSummary.AgeBucket> ageBuckets = new ArrayList<>();
        for (int i = 0; i < AGE_LABELS.length; i++) {
            Accumulator acc = byAge.get(i);
            ageBuckets.add(new UnsettledSummary.AgeBucket(AGE_LABELS[i], acc.count, acc.remaining));
        }

        return UnsettledSummary.builder()
            .totalCount(open.size())
            .totalRemaining(total)
            .byStatus(statusBuckets)
            .byAge(ageBuckets)
            .generatedAt(now)
            .build();
    }

    static int ageBucket(Instant createdAt, Instant now) {
        long days = Math.max(0, Duration.between(createdAt, now).toDays());
        for (int i = 0; i < AGE_LIMITS.length; i++) {
            if (days <= AGE_LIMITS[i]) {
                return i;
            }
        }
        return AGE_LIMITS.length;
    }

    private static final class Accumulator {
        private long count;
        private final Map<CurrencyCode, BigDecimal> remaining = new EnumMap<>(CurrencyCode.class);

        void add(OutgoingRemittance o) {
            count++;
            remaining.merge(o.getCurrency(), o.getRemainingAmount(), BigDecimal::add);
        }
    }
}
