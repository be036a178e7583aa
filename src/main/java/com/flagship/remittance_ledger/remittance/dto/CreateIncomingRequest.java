package com.flagship.remittance_ledger.remittance.dto;

import jakarta.validation.constraints.DecimalMin;
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
 * Body of {@code POST /api/remittances/incoming}.
 */
@Getter
@Setter
@NoArgsConstructor
public class CreateIncomingRequest {

    @NotNull(message = "Branch ID is required")
    private UUID branchId;

    @NotBlank(message = "Sender name is required")
    private String senderName;

    @NotBlank(message = "Sender phone is required")
    private String senderPhone;

    private String senderIban;
    private String senderBank;

    @NotBlank(message = "Recipient name is required")
    private String recipientName;

    private String recipientPhone;
    private String recipientEmail;
    private String recipientAddress;

    @NotBlank(message = "Currency is required")
    @Pattern(regexp = "^[A-Z]{3}$", message = "Currency must be a 3-letter ISO code")
    private String currency;

    @NotNull(message = "Amount is required")
    @DecimalMin(value = "0.01", message = "Amount must be greater than 0")
    @Digits(integer = 18, fraction = 2, message = "Amount allows at most 2 decimal places")
    private BigDecimal amount;

    @NotNull(message = "Payout rate is required")
    @DecimalMin(value = "0", inclusive = false, message = "Payout rate must be greater than 0")
    @Digits(integer = 14, fraction = 6, message = "Payout rate allows at most 6 decimal places")
    private BigDecimal payoutRate;

    @NotBlank(message = "Funding currency is required")
    @Pattern(regexp = "^[A-Z]{3}$", message = "Funding currency must be a 3-letter ISO code")
    private String fundingCurrency;

    @DecimalMin(value = "0", message = "Fee cannot be negative")
    private BigDecimal fee;

    private String notes;
}
