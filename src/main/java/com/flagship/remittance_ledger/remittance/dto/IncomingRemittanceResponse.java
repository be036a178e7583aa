package com.flagship.remittance_ledger.remittance.dto;

import com.flagship.remittance_ledger.remittance.IncomingRemittance;
import com.flagship.remittance_ledger.remittance.RemittanceStatus;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class IncomingRemittanceResponse {
    UUID id;
    UUID branchId;
    String remittanceCode;
    String senderName;
    String recipientName;
    String currency;
    BigDecimal amount;
    BigDecimal payoutRate;
    String fundingCurrency;
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
    Instant cancelledAt;
    String cancellationReason;

    public static IncomingRemittanceResponse from(IncomingRemittance remittance) {
        return IncomingRemittanceResponse.builder()
            .id(remittance.getId())
            .branchId(remittance.getBranchId())
            .remittanceCode(remittance.getRemittanceCode())
            .senderName(remittance.getSenderName())
            .recipientName(remittance.getRecipientName())
            .currency(remittance.getCurrency().name())
            .amount(remittance.getAmount())
            .payoutRate(remittance.getPayoutRate())
            .fundingCurrency(remittance.getFundingCurrency().name())
            .payoutAmount(remittance.getPayoutAmount())
            .fee(remittance.getFee())
            .allocatedAmount(remittance.getAllocatedAmount())
            .remainingAmount(remittance.getRemainingAmount())
            .status(remittance.getStatus())
            .paidAmount(remittance.getPaidAmount())
            .paymentMethod(remittance.getPaymentMethod())
            .paymentReference(remittance.getPaymentReference())
            .notes(remittance.getNotes())
            .createdBy(remittance.getCreatedBy())
            .createdAt(remittance.getCreatedAt())
            .updatedAt(remittance.getUpdatedAt())
            .completedAt(remittance.getCompletedAt())
            .paidAt(remittance.getPaidAt())
            .cancelledAt(remittance.getCancelledAt())
            .cancellationReason(remittance.getCancellationReason())
            .build();
    }
}
