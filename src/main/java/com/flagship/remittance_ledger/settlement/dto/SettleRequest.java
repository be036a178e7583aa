package com.flagship.remittance_ledger.settlement.dto;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigDecimal;
import java.util.UUID;

@Getter
@Setter
@NoArgsConstructor
public class SettleRequest {

    @NotNull(message = "Outgoing remittance ID is required")
    private UUID outgoingId;

    @NotNull(message = "Incoming remittance ID is required")
    private UUID incomingId;

    @NotNull(message = "Amount is required")
    @DecimalMin(value = "0.01", message = "Amount must be greater than 0")
    @Digits(integer = 18, fraction = 2, message = "Amount allows at most 2 decimal places")
    private BigDecimal amount;

    private String notes;
}
