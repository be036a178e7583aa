package com.flagship.remittance_ledger.allocation.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Getter
@Setter
@NoArgsConstructor
public class AllocationPreviewRequest {

    @NotNull(message = "Total amount is required")
    @DecimalMin(value = "0.01", message = "Total amount must be greater than 0")
    private BigDecimal totalAmount;

    /** FIFO, LIFO, BEST_RATE or PROPORTIONAL; FIFO when omitted. */
    private String strategy;

    @NotEmpty(message = "At least one item is required")
    @Valid
    private List<Item> items;

    @Getter
    @Setter
    @NoArgsConstructor
    public static class Item {

        @NotNull(message = "Item ID is required")
        private UUID id;

        @NotNull(message = "Item createdAt is required")
        private Instant createdAt;

        @NotNull(message = "Item remaining is required")
        @DecimalMin(value = "0.01", message = "Item remaining must be greater than 0")
        private BigDecimal remaining;

        private BigDecimal rate;
    }
}
