package com.flagship.remittance_ledger.remittance.dto;

import com.flagship.remittance_ledger.remittance.OutgoingRemittance;
import com.flagship.remittance_ledger.remittance.RemittanceStatus;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class OutgoingRemittanceResponse {
    UUID id;
    UUID branchId;
    String remittanceCode;
    String senderName;
    String recipientName;
    String currency;
    BigDecimal amount;
    BigDecimal acquisitionRate;
    String fundingCurrency;
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
    String cancellationReason;

    public static OutgoingRemittanceResponse from(OutgoingRemittance remittance) {
        return OutgoingRemittanceResponse.builder()
            .id(remittance.getId())
            .branchId(remittance.getBranchId())
            .remittanceCode(remittance.getRemittanceCode())
            .senderName(remittance.getSenderName())
            .recipientName(remittance.getRecipientName())
            .currency(remittance.getCurrency().name())
            .amount(remittance.getAmount())
            .acquisitionRate(remittance.getAcquisitionRate())
            .fundingCurrency(remittance.getFundingCurrency().name())
            .receivedAmount(remittance.getReceivedAmount())
            .fee(remittance.getFee())
            .totalCost(remittance.getTotalCost())
            .settledAmount(remittance.getSettledAmount())
            .remainingAmount(remittance.getRemainingAmount())
            .status(remittance.getStatus())
            .totalProfit(remittance.getTotalProfit())
            .notes(remittance.getNotes())
            .createdBy(remittance.getCreatedBy())
            .createdAt(remittance.getCreatedAt())
            .updatedAt(remittance.getUpdatedAt())
            .completedAt(remittance.getCompletedAt())
            .cancelledAt(remittance.getCancelledAt())
            .cancellationReason(remittance.getCancellationReason())
            .build();
    }
}
