package com.flagship.remittance_ledger.remittance.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Getter
@Setter
@NoArgsConstructor
public class CancelRequest {

    @NotBlank(message = "Cancellation reason is required")
    @Size(max = 1000)
    private String reason;
}
