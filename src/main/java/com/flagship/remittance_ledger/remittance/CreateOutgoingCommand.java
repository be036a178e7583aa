package com.flagship.remittance_ledger.remittance;

import com.flagship.remittance_ledger.common.CurrencyCode;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

@Value
@Builder
public class CreateOutgoingCommand {
    UUID tenantId;
    UUID branchId;
    UUID actorId;
    String idempotencyKey;

    String senderName;
    String senderPhone;
    String senderEmail;
    String recipientName;
    String recipientPhone;
    String recipientIban;
    String recipientBank;
    String recipientAddress;

    CurrencyCode currency;
    BigDecimal amount;
    BigDecimal acquisitionRate;
    CurrencyCode fundingCurrency;
    BigDecimal receivedAmount;
    BigDecimal fee;
    String notes;
}
