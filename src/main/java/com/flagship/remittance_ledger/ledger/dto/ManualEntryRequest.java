package com.flagship.remittance_ledger.ledger.dto;

import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Signed operator adjustment: positive adds cash to the branch, negative removes it.
 */
@Getter
@Setter
@NoArgsConstructor
public class ManualEntryRequest {

    @NotNull(message = "Branch ID is required")
    private UUID branchId;

    @NotBlank(message = "Currency is required")
    @Pattern(regexp = "^[A-Z]{3}$", message = "Currency must be a 3-letter ISO code")
    private String currency;

    @NotNull(message = "Amount is required")
    @Digits(integer = 18, fraction = 6, message = "Amount allows at most 6 decimal places")
    private BigDecimal amount;

    @NotBlank(message = "Description is required")
    private String description;
}
