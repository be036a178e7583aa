package com.flagship.remittance_ledger.allocation;

import lombok.Value;

import java.math.BigDecimal;
import java.util.List;

/**
 * Result of spreading a payment: one line per item in allocation order,
 * zero-amount lines included. {@code totalAllocated + unallocated == totalAmount}.
 */
@Value
public class AllocationPlan {
    AllocationMode mode;
    BigDecimal totalAmount;
    List<Allocation> allocations;
    BigDecimal totalAllocated;
    BigDecimal unallocated;
}
