package com.flagship.remittance_ledger.settlement.dto;

import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.UUID;

@Getter
@Setter
@NoArgsConstructor
public class AutoSettleRequest {

    @NotNull(message = "Outgoing remittance ID is required")
    private UUID outgoingId;

    /** FIFO, LIFO or BEST_RATE; FIFO when omitted. */
    private String strategy;
}
