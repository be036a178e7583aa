package com.flagship.remittance_ledger.remittance;

import com.flagship.remittance_ledger.common.CurrencyCode;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * An outbound transfer: the customer paid {@code receivedAmount} in the funding
 * currency and the exchange now owes {@code amount} in the debt currency abroad.
 * {@code acquisitionRate} is the buy rate in debt units per funding unit.
 */
@Value
@Builder(toBuilder = true)
public class OutgoingRemittance {
    UUID id;
    UUID tenantId;
    UUID branchId;
    String remittanceCode;

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
    BigDecimal totalCost;

    BigDecimal settledAmount;
    BigDecimal remainingAmount;
    RemittanceStatus status;
    BigDecimal totalProfit;

    String notes;
    UUID createdBy;
    Instant createdAt;
    Instant updatedAt;
    Instant completedAt;
    Instant cancelledAt;
    UUID cancelledBy;
    String cancellationReason;
    Long version;
}
