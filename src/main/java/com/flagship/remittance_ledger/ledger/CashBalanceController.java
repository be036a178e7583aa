package com.flagship.remittance_ledger.ledger;

import com.flagship.remittance_ledger.common.ApiHeaders;
import com.flagship.remittance_ledger.common.CurrencyCode;
import com.flagship.remittance_ledger.ledger.dto.ManualEntryRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

/**
 * Branch cash positions and their reconciliation against the entry log.
 */
@RestController
@RequestMapping("/api/cash-balances")
@RequiredArgsConstructor
public class CashBalanceController {

    private final CashLedgerService cashLedgerService;

    @GetMapping("/{branchId}/{currency}")
    public CashBalance balance(@RequestHeader(ApiHeaders.TENANT_ID) UUID tenantId,
                               @PathVariable("branchId") UUID branchId,
                               @PathVariable("currency") String currency) {
        return cashLedgerService.getBalance(tenantId, branchId, CurrencyCode.of(currency));
    }

    @PostMapping("/{branchId}/{currency}/refresh")
    public BalanceReconciliation refresh(@RequestHeader(ApiHeaders.TENANT_ID) UUID tenantId,
                                         @PathVariable("branchId") UUID branchId,
                                         @PathVariable("currency") String currency) {
        return cashLedgerService.refresh(tenantId, branchId, CurrencyCode.of(currency));
    }

    @PostMapping("/refresh")
    public List<BalanceReconciliation> refreshAll(@RequestHeader(ApiHeaders.TENANT_ID) UUID tenantId) {
        return cashLedgerService.refreshAll(tenantId);
    }

    @PostMapping("/entries")
    public ResponseEntity<CashLedgerEntry> manualEntry(@RequestHeader(ApiHeaders.TENANT_ID) UUID tenantId,
                                                       @RequestHeader(ApiHeaders.ACTOR_ID) UUID actorId,
                                                       @Valid @RequestBody ManualEntryRequest request) {
        CashLedgerEntry entry = cashLedgerService.recordManualEntry(tenantId, request.getBranchId(),
            CurrencyCode.of(request.getCurrency()), request.getAmount(), actorId, request.getDescription());
        return ResponseEntity.status(HttpStatus.CREATED).body(entry);
    }
}
