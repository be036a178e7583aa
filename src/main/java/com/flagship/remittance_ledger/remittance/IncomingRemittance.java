package com.flagship.remittance_ledger.remittance;

import com.flagship.remittance_ledger.common.CurrencyCode;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * An inbound transfer: {@code amount} in the debt currency was collected abroad
 * and becomes funds for settling outgoing debts. The recipient is owed
 * {@code payoutAmount} in the funding currency, derived from {@code payoutRate}.
 */
@Value
@Builder(toBuilder = true)
public class IncomingRemittance {
    UUID id;
    UUID tenantId;
    UUID branchId;
    String remittanceCode;

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
    BigDecimal payoutAmount;
    BigDecimal fee;

    BigDecimal allocatedAmount;
    BigDecimal remainingAmount;
    RemittanceStatus status;

    BigDecimal paidAmount;
    String paymentMethod;
    String paymentReference;

    String notes;
    UUID createdBy;
    Instant createdAt;
    Instant updatedAt;
    Instant completedAt;
    Instant paidAt;
    UUID paidBy;
    Instant cancelledAt;
    UUID cancelledBy;
    String cancellationReason;
    Long version;
}
