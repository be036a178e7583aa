package com.flagship.remittance_ledger.settlement;

import com.flagship.remittance_ledger.common.ApiHeaders;
import com.flagship.remittance_ledger.config.SettlementProperties;
import com.flagship.remittance_ledger.observability.SettlementMetrics;
import com.flagship.remittance_ledger.settlement.dto.AutoSettleRequest;
import com.flagship.remittance_ledger.settlement.dto.SettleRequest;
import com.flagship.remittance_ledger.settlement.dto.SettlementResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Duration;
import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/settlements")
@RequiredArgsConstructor
@Slf4j
public class SettlementController {

    private final SettlementService settlementService;
    private final SettlementSuggestionService suggestionService;
    private final AutoSettlementService autoSettlementService;
    private final SettlementProperties properties;
    private final SettlementMetrics metrics;

    @PostMapping
    public ResponseEntity<SettlementResponse> settle(@RequestHeader(ApiHeaders.TENANT_ID) UUID tenantId,
                                                     @RequestHeader(ApiHeaders.ACTOR_ID) UUID actorId,
                                                     @Valid @RequestBody SettleRequest request) {
        long start = System.nanoTime();
        try {
            Settlement settlement = settlementService.settle(tenantId, request.getOutgoingId(), request.getIncomingId(),
                request.getAmount(), actorId, request.getNotes());
            return ResponseEntity.status(HttpStatus.CREATED).body(SettlementResponse.from(settlement));
        } finally {
            metrics.recordApiLatency("settle", Duration.ofNanos(System.nanoTime() - start));
        }
    }

    /**
     * Settlements on either side of the remittance, oldest first.
     */
    @GetMapping
    public List<SettlementResponse> history(@RequestHeader(ApiHeaders.TENANT_ID) UUID tenantId,
                                            @RequestParam("remittanceId") UUID remittanceId) {
        return settlementService.settlementHistory(tenantId, remittanceId).stream()
            .map(SettlementResponse::from)
            .toList();
    }

    @GetMapping("/suggestions")
    public List<SettlementSuggestion> suggestions(@RequestHeader(ApiHeaders.TENANT_ID) UUID tenantId,
                                                  @RequestParam("outgoingId") UUID outgoingId,
                                                  @RequestParam(value = "strategy", required = false) String strategy,
                                                  @RequestParam(value = "limit", required = false) Integer limit) {
        int effectiveLimit = limit != null ? limit : properties.getSuggestion().getDefaultLimit();
        return suggestionService.suggestSettlements(tenantId, outgoingId, SettlementStrategy.parse(strategy), effectiveLimit);
    }

    @PostMapping("/auto")
    public AutoSettleResult autoSettle(@RequestHeader(ApiHeaders.TENANT_ID) UUID tenantId,
                                       @RequestHeader(ApiHeaders.ACTOR_ID) UUID actorId,
                                       @Valid @RequestBody AutoSettleRequest request) {
        long start = System.nanoTime();
        try {
            return autoSettlementService.autoSettle(tenantId, request.getOutgoingId(), actorId,
                SettlementStrategy.parse(request.getStrategy()));
        } finally {
            metrics.recordApiLatency("auto_settle", Duration.ofNanos(System.nanoTime() - start));
        }
    }
}
