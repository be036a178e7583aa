package com.flagship.remittance_ledger.remittance;

import com.flagship.remittance_ledger.common.CurrencyCode;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

@Value
@Builder
public class CreateIncomingCommand {
    UUID tenantId;
    UUID branchId;
    UUID actorId;
    String idempotencyKey;

    String senderName;
    String senderPhone;
    String senderIban;
    String senderBank;
    String recipientName;
    String recipientPhone;
    String recipientEmail;
    String recipientAddress;

    CurrencyCode currency;
    BigDecimal amount;
    BigDecimal payoutRate;
    CurrencyCode fundingCurrency;
    BigDecimal fee;
    String notes;
}
