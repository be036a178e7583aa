package com.flagship.remittance_ledger.remittance;

import com.flagship.remittance_ledger.common.ApiHeaders;
import com.flagship.remittance_ledger.common.CurrencyCode;
import com.flagship.remittance_ledger.observability.SettlementMetrics;
import com.flagship.remittance_ledger.remittance.dto.CancelRequest;
import com.flagship.remittance_ledger.remittance.dto.CreateIncomingRequest;
import com.flagship.remittance_ledger.remittance.dto.CreateOutgoingRequest;
import com.flagship.remittance_ledger.remittance.dto.IncomingRemittanceResponse;
import com.flagship.remittance_ledger.remittance.dto.MarkPaidRequest;
import com.flagship.remittance_ledger.remittance.dto.OutgoingRemittanceResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Duration;
import java.util.EnumSet;
import java.util.List;
import java.util.UUID;

/**
 * REST endpoints for the outgoing and incoming registers.
 *
 * Creation honours an optional {@code Idempotency-Key}: a repeated key returns
 * the remittance created by the first request.
 */
@RestController
@RequestMapping("/api/remittances")
@RequiredArgsConstructor
@Slf4j
public class RemittanceController {

    private final RemittanceService remittanceService;
    private final UnsettledSummaryService unsettledSummaryService;
    private final SettlementMetrics metrics;

    @PostMapping("/outgoing")
    public ResponseEntity<OutgoingRemittanceResponse> createOutgoing(
            @RequestHeader(ApiHeaders.TENANT_ID) UUID tenantId,
            @RequestHeader(ApiHeaders.ACTOR_ID) UUID actorId,
            @RequestHeader(value = ApiHeaders.IDEMPOTENCY_KEY, required = false) String idempotencyKey,
            @Valid @RequestBody CreateOutgoingRequest request) {

        long start = System.nanoTime();
        log.info("Received outgoing remittance request: amount={} {}, rate={}",
            request.getAmount(), request.getCurrency(), request.getAcquisitionRate());
        try {
            OutgoingRemittance created = remittanceService.createOutgoing(CreateOutgoingCommand.builder()
                .tenantId(tenantId)
                .branchId(request.getBranchId())
                .actorId(actorId)
                .idempotencyKey(idempotencyKey)
                .senderName(request.getSenderName())
                .senderPhone(request.getSenderPhone())
                .senderEmail(request.getSenderEmail())
                .recipientName(request.getRecipientName())
                .recipientPhone(request.getRecipientPhone())
                .recipientIban(request.getRecipientIban())
                .recipientBank(request.getRecipientBank())
                .recipientAddress(request.getRecipientAddress())
                .currency(CurrencyCode.of(request.getCurrency()))
                .amount(request.getAmount())
                .acquisitionRate(request.getAcquisitionRate())
                .fundingCurrency(CurrencyCode.of(request.getFundingCurrency()))
                .receivedAmount(request.getReceivedAmount())
                .fee(request.getFee())
                .notes(request.getNotes())
                .build());
            return ResponseEntity.status(HttpStatus.CREATED).body(OutgoingRemittanceResponse.from(created));
        } finally {
            metrics.recordApiLatency("create_outgoing", Duration.ofNanos(System.nanoTime() - start));
        }
    }

    @PostMapping("/incoming")
    public ResponseEntity<IncomingRemittanceResponse> createIncoming(
            @RequestHeader(ApiHeaders.TENANT_ID) UUID tenantId,
            @RequestHeader(ApiHeaders.ACTOR_ID) UUID actorId,
            @RequestHeader(value = ApiHeaders.IDEMPOTENCY_KEY, required = false) String idempotencyKey,
            @Valid @RequestBody CreateIncomingRequest request) {

        long start = System.nanoTime();
        log.info("Received incoming remittance request: amount={} {}, rate={}",
            request.getAmount(), request.getCurrency(), request.getPayoutRate());
        try {
            IncomingRemittance created = remittanceService.createIncoming(CreateIncomingCommand.builder()
                .tenantId(tenantId)
                .branchId(request.getBranchId())
                .actorId(actorId)
                .idempotencyKey(idempotencyKey)
                .senderName(request.getSenderName())
                .senderPhone(request.getSenderPhone())
                .senderIban(request.getSenderIban())
                .senderBank(request.getSenderBank())
                .recipientName(request.getRecipientName())
                .recipientPhone(request.getRecipientPhone())
                .recipientEmail(request.getRecipientEmail())
                .recipientAddress(request.getRecipientAddress())
                .currency(CurrencyCode.of(request.getCurrency()))
                .amount(request.getAmount())
                .payoutRate(request.getPayoutRate())
                .fundingCurrency(CurrencyCode.of(request.getFundingCurrency()))
                .fee(request.getFee())
                .notes(request.getNotes())
                .build());
            return ResponseEntity.status(HttpStatus.CREATED).body(IncomingRemittanceResponse.from(created));
        } finally {
            metrics.recordApiLatency("create_incoming", Duration.ofNanos(System.nanoTime() - start));
        }
    }

    @GetMapping("/outgoing/{id}")
    public OutgoingRemittanceResponse getOutgoing(@RequestHeader(ApiHeaders.TENANT_ID) UUID tenantId,
                                                  @PathVariable("id") UUID id) {
        return OutgoingRemittanceResponse.from(remittanceService.getOutgoing(tenantId, id));
    }

    @GetMapping("/incoming/{id}")
    public IncomingRemittanceResponse getIncoming(@RequestHeader(ApiHeaders.TENANT_ID) UUID tenantId,
                                                  @PathVariable("id") UUID id) {
        return IncomingRemittanceResponse.from(remittanceService.getIncoming(tenantId, id));
    }

    /**
     * Lists outgoing remittances oldest first. {@code unsettled=true} keeps only PENDING and PARTIAL;
     * {@code status} and {@code branchId} narrow the list further.
     */
    @GetMapping("/outgoing")
    public List<OutgoingRemittanceResponse> listOutgoing(
            @RequestHeader(ApiHeaders.TENANT_ID) UUID tenantId,
            @RequestParam(value = "unsettled", defaultValue = "false") boolean unsettled,
            @RequestParam(value = "status", required = false) RemittanceStatus status,
            @RequestParam(value = "branchId", required = false) UUID branchId) {
        return remittanceService.listOutgoing(tenantId, branchId, statusFilter(unsettled, status)).stream()
            .map(OutgoingRemittanceResponse::from)
            .toList();
    }

    @GetMapping("/incoming")
    public List<IncomingRemittanceResponse> listIncoming(
            @RequestHeader(ApiHeaders.TENANT_ID) UUID tenantId,
            @RequestParam(value = "unsettled", defaultValue = "false") boolean unsettled,
            @RequestParam(value = "status", required = false) RemittanceStatus status,
            @RequestParam(value = "branchId", required = false) UUID branchId) {
        return remittanceService.listIncoming(tenantId, branchId, statusFilter(unsettled, status)).stream()
            .map(IncomingRemittanceResponse::from)
            .toList();
    }

    private static EnumSet<RemittanceStatus> statusFilter(boolean unsettled, RemittanceStatus status) {
        EnumSet<RemittanceStatus> statuses = unsettled
            ? EnumSet.of(RemittanceStatus.PENDING, RemittanceStatus.PARTIAL)
            : EnumSet.allOf(RemittanceStatus.class);
        if (status != null) {
            statuses.retainAll(EnumSet.of(status));
        }
        return statuses;
    }

    @PostMapping("/outgoing/{id}/cancel")
    public OutgoingRemittanceResponse cancelOutgoing(@RequestHeader(ApiHeaders.TENANT_ID) UUID tenantId,
                                                     @RequestHeader(ApiHeaders.ACTOR_ID) UUID actorId,
                                                     @PathVariable("id") UUID id,
                                                     @Valid @RequestBody CancelRequest request) {
        return OutgoingRemittanceResponse.from(
            remittanceService.cancelOutgoing(tenantId, id, actorId, request.getReason()));
    }

    @PostMapping("/incoming/{id}/cancel")
    public IncomingRemittanceResponse cancelIncoming(@RequestHeader(ApiHeaders.TENANT_ID) UUID tenantId,
                                                     @RequestHeader(ApiHeaders.ACTOR_ID) UUID actorId,
                                                     @PathVariable("id") UUID id,
                                                     @Valid @RequestBody CancelRequest request) {
        return IncomingRemittanceResponse.from(
            remittanceService.cancelIncoming(tenantId, id, actorId, request.getReason()));
    }

    @PostMapping("/incoming/{id}/pay")
    public IncomingRemittanceResponse markPaid(@RequestHeader(ApiHeaders.TENANT_ID) UUID tenantId,
                                               @RequestHeader(ApiHeaders.ACTOR_ID) UUID actorId,
                                               @PathVariable("id") UUID id,
                                               @Valid @RequestBody MarkPaidRequest request) {
        return IncomingRemittanceResponse.from(remittanceService.markIncomingPaid(
            tenantId, id, actorId, request.getPaymentMethod(), request.getPaymentReference()));
    }

    @GetMapping("/unsettled-summary")
    public UnsettledSummary unsettledSummary(@RequestHeader(ApiHeaders.TENANT_ID) UUID tenantId) {
        return unsettledSummaryService.unsettledSummary(tenantId);
    }
}
