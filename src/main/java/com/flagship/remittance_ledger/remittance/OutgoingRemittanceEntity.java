package com.flagship.remittance_ledger.remittance;

import com.flagship.remittance_ledger.common.CurrencyCode;
import com.flagship.remittance_ledger.exception.InsufficientFundsException;
import com.flagship.remittance_ledger.exception.InvalidRemittanceStateException;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.UUID;

/**
 * Persistent form of {@link OutgoingRemittance}.
 *
 * There are no setters. Balances move only through {@link #applySettlement},
 * and the terminal transition only through {@link #cancel}; both re-derive the
 * status so {@code settled + remaining == amount} holds after every change.
 */
@Entity
@Table(name = "outgoing_remittances")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class OutgoingRemittanceEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "tenant_id", nullable = false, updatable = false)
    private UUID tenantId;

    @Column(name = "branch_id", nullable = false, updatable = false)
    private UUID branchId;

    @Column(name = "remittance_code", nullable = false, updatable = false, length = 20)
    private String remittanceCode;

    @Column(name = "sender_name", nullable = false)
    private String senderName;

    @Column(name = "sender_phone", nullable = false)
    private String senderPhone;

    @Column(name = "sender_email")
    private String senderEmail;

    @Column(name = "recipient_name", nullable = false)
    private String recipientName;

    @Column(name = "recipient_phone")
    private String recipientPhone;

    @Column(name = "recipient_iban")
    private String recipientIban;

    @Column(name = "recipient_bank")
    private String recipientBank;

    @Column(name = "recipient_address")
    private String recipientAddress;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false, length = 3)
    private CurrencyCode currency;

    @Column(nullable = false, updatable = false, precision = 20, scale = 2)
    private BigDecimal amount;

    @Column(name = "acquisition_rate", nullable = false, updatable = false, precision = 20, scale = 6)
    private BigDecimal acquisitionRate;

    @Enumerated(EnumType.STRING)
    @Column(name = "funding_currency", nullable = false, updatable = false, length = 3)
    private CurrencyCode fundingCurrency;

    @Column(name = "received_amount", nullable = false, updatable = false, precision = 20, scale = 2)
    private BigDecimal receivedAmount;

    @Column(nullable = false, updatable = false, precision = 20, scale = 2)
    private BigDecimal fee;

    @Column(name = "total_cost", nullable = false, updatable = false, precision = 24, scale = 6)
    private BigDecimal totalCost;

    @Column(name = "settled_amount", nullable = false, precision = 20, scale = 2)
    private BigDecimal settledAmount;

    @Column(name = "remaining_amount", nullable = false, precision = 20, scale = 2)
    private BigDecimal remainingAmount;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private RemittanceStatus status;

    @Column(name = "total_profit", nullable = false, precision = 24, scale = 6)
    private BigDecimal totalProfit;

    @Column
    private String notes;

    @Column(name = "idempotency_key", updatable = false)
    private String idempotencyKey;

    @Column(name = "created_by", nullable = false, updatable = false)
    private UUID createdBy;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    @Column(name = "cancelled_at")
    private Instant cancelledAt;

    @Column(name = "cancelled_by")
    private UUID cancelledBy;

    @Column(name = "cancellation_reason")
    private String cancellationReason;

    @Version
    private Long version;

    /**
     * Builds a new, unsaved entity. Balances start at settled 0 / remaining = amount.
     */
    static OutgoingRemittanceEntity fromDomain(OutgoingRemittance remittance, String idempotencyKey) {
        OutgoingRemittanceEntity entity = new OutgoingRemittanceEntity();
        entity.id = remittance.getId();
        entity.tenantId = remittance.getTenantId();
        entity.branchId = remittance.getBranchId();
        entity.remittanceCode = remittance.getRemittanceCode();
        entity.senderName = remittance.getSenderName();
        entity.senderPhone = remittance.getSenderPhone();
        entity.senderEmail = remittance.getSenderEmail();
        entity.recipientName = remittance.getRecipientName();
        entity.recipientPhone = remittance.getRecipientPhone();
        entity.recipientIban = remittance.getRecipientIban();
        entity.recipientBank = remittance.getRecipientBank();
        entity.recipientAddress = remittance.getRecipientAddress();
        entity.currency = remittance.getCurrency();
        entity.amount = remittance.getAmount();
        entity.acquisitionRate = remittance.getAcquisitionRate();
        entity.fundingCurrency = remittance.getFundingCurrency();
        entity.receivedAmount = remittance.getReceivedAmount();
        entity.fee = remittance.getFee();
        entity.totalCost = remittance.getTotalCost();
        entity.settledAmount = BigDecimal.ZERO.setScale(2);
        entity.remainingAmount = remittance.getAmount();
        entity.status = RemittanceStatus.PENDING;
        entity.totalProfit = BigDecimal.ZERO.setScale(6);
        entity.notes = remittance.getNotes();
        entity.idempotencyKey = idempotencyKey;
        entity.createdBy = remittance.getCreatedBy();
        entity.createdAt = remittance.getCreatedAt();
        entity.updatedAt = remittance.getCreatedAt();
        return entity;
    }

    public OutgoingRemittance toDomain() {
        return OutgoingRemittance.builder()
            .id(id)
            .tenantId(tenantId)
            .branchId(branchId)
            .remittanceCode(remittanceCode)
            .senderName(senderName)
            .senderPhone(senderPhone)
            .senderEmail(senderEmail)
            .recipientName(recipientName)
            .recipientPhone(recipientPhone)
            .recipientIban(recipientIban)
            .recipientBank(recipientBank)
            .recipientAddress(recipientAddress)
            .currency(currency)
            .amount(amount)
            .acquisitionRate(acquisitionRate)
            .fundingCurrency(fundingCurrency)
            .receivedAmount(receivedAmount)
            .fee(fee)
            .totalCost(totalCost)
            .settledAmount(settledAmount)
            .remainingAmount(remainingAmount)
            .status(status)
            .totalProfit(totalProfit)
            .notes(notes)
            .createdBy(createdBy)
            .createdAt(createdAt)
            .updatedAt(updatedAt)
            .completedAt(completedAt)
            .cancelledAt(cancelledAt)
            .cancelledBy(cancelledBy)
            .cancellationReason(cancellationReason)
            .version(version)
            .build();
    }

    public void ensureOpen() {
        if (status.isTerminal()) {
            throw new InvalidRemittanceStateException(id,
                "Outgoing remittance " + remittanceCode + " is " + status + " and cannot be settled");
        }
    }

    /**
     * Moves {@code settleAmount} from remaining to settled and books the profit.
     */
    public void applySettlement(BigDecimal settleAmount, BigDecimal profit, Instant now) {
        ensureOpen();
        if (settleAmount.compareTo(remainingAmount) > 0) {
            throw new InsufficientFundsException(settleAmount, remainingAmount);
        }
        this.settledAmount = settledAmount.add(settleAmount);
        this.remainingAmount = remainingAmount.subtract(settleAmount);
        this.totalProfit = totalProfit.add(profit).setScale(6, RoundingMode.HALF_EVEN);
        this.status = RemittanceStatus.fromBalances(settledAmount, remainingAmount);
        if (status == RemittanceStatus.COMPLETED) {
            this.completedAt = now;
        }
        this.updatedAt = now;
    }

    /**
     * Only an untouched PENDING debt can be cancelled.
     */
    public void cancel(UUID actorId, String reason, Instant now) {
        if (status == RemittanceStatus.CANCELLED) {
            throw new InvalidRemittanceStateException(id, "Outgoing remittance " + remittanceCode + " is already cancelled");
        }
        if (status != RemittanceStatus.PENDING || settledAmount.signum() > 0) {
            throw new InvalidRemittanceStateException(id,
                "Outgoing remittance " + remittanceCode + " has settled amount " + settledAmount.toPlainString()
                    + " and cannot be cancelled");
        }
        this.status = RemittanceStatus.CANCELLED;
        this.cancelledAt = now;
        this.cancelledBy = actorId;
        this.cancellationReason = reason;
        this.updatedAt = now;
    }
}
