package com.flagship.remittance_ledger.allocation;

import com.flagship.remittance_ledger.allocation.dto.AllocationPreviewRequest;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Dry-run of spreading one customer payment over several open items.
 */
@RestController
@RequestMapping("/api/allocations")
@Slf4j
public class AllocationController {

    @PostMapping("/preview")
    public AllocationPlan preview(@Valid @RequestBody AllocationPreviewRequest request) {
        List<OpenItem> items = request.getItems().stream()
            .map(item -> new OpenItem(item.getId(), item.getCreatedAt(), item.getRemaining(), item.getRate()))
            .toList();
        AllocationPlan plan = PaymentAllocator.allocate(items, request.getTotalAmount(),
            AllocationMode.parse(request.getStrategy()));
        log.debug("Allocation preview {}: allocated={}, unallocated={}",
            plan.getMode(), plan.getTotalAllocated(), plan.getUnallocated());
        return plan;
    }
}
