package com.flagship.remittance_ledger.remittance.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Getter
@Setter
@NoArgsConstructor
public class MarkPaidRequest {

    /** e.g. CASH, BANK_TRANSFER */
    @NotBlank(message = "Payment method is required")
    private String paymentMethod;

    private String paymentReference;
}
