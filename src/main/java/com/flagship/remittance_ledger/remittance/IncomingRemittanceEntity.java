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
import java.time.Instant;
import java.util.UUID;

/**
 * Persistent form of {@link IncomingRemittance}. Mirrors the outgoing entity;
 * adds the payout transition COMPLETED → PAID.
 */
@Entity
@Table(name = "incoming_remittances")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class IncomingRemittanceEntity {

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

    @Column(name = "sender_iban")
    private String senderIban;

    @Column(name = "sender_bank")
    private String senderBank;

    @Column(name = "recipient_name", nullable = false)
    private String recipientName;

    @Column(name = "recipient_phone")
    private String recipientPhone;

    @Column(name = "recipient_email")
    private String recipientEmail;

    @Column(name = "recipient_address")
    private String recipientAddress;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false, length = 3)
    private CurrencyCode currency;

    @Column(nullable = false, updatable = false, precision = 20, scale = 2)
    private BigDecimal amount;

    @Column(name = "payout_rate", nullable = false, updatable = false, precision = 20, scale = 6)
    private BigDecimal payoutRate;

    @Enumerated(EnumType.STRING)
    @Column(name = "funding_currency", nullable = false, updatable = false, length = 3)
    private CurrencyCode fundingCurrency;

    @Column(name = "payout_amount", nullable = false, updatable = false, precision = 20, scale = 2)
    private BigDecimal payoutAmount;

    @Column(nullable = false, updatable = false, precision = 20, scale = 2)
    private BigDecimal fee;

    @Column(name = "allocated_amount", nullable = false, precision = 20, scale = 2)
    private BigDecimal allocatedAmount;

    @Column(name = "remaining_amount", nullable = false, precision = 20, scale = 2)
    private BigDecimal remainingAmount;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private RemittanceStatus status;

    @Column(name = "paid_amount", nullable = false, precision = 20, scale = 2)
    private BigDecimal paidAmount;

    @Column(name = "payment_method", length = 50)
    private String paymentMethod;

    @Column(name = "payment_reference")
    private String paymentReference;

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

    @Column(name = "paid_at")
    private Instant paidAt;

    @Column(name = "paid_by")
    private UUID paidBy;

    @Column(name = "cancelled_at")
    private Instant cancelledAt;

    @Column(name = "cancelled_by")
    private UUID cancelledBy;

    @Column(name = "cancellation_reason")
    private String cancellationReason;

    @Version
    private Long version;

    static IncomingRemittanceEntity fromDomain(IncomingRemittance remittance, String idempotencyKey) {
        IncomingRemittanceEntity entity = new IncomingRemittanceEntity();
        entity.id = remittance.getId();
        entity.tenantId = remittance.getTenantId();
        entity.branchId = remittance.getBranchId();
        entity.remittanceCode = remittance.getRemittanceCode();
        entity.senderName = remittance.getSenderName();
        entity.senderPhone = remittance.getSenderPhone();
        entity.senderIban = remittance.getSenderIban();
        entity.senderBank = remittance.getSenderBank();
        entity.recipientName = remittance.getRecipientName();
        entity.recipientPhone = remittance.getRecipientPhone();
        entity.recipientEmail = remittance.getRecipientEmail();
        entity.recipientAddress = remittance.getRecipientAddress();
        entity.currency = remittance.getCurrency();
        entity.amount = remittance.getAmount();
        entity.payoutRate = remittance.getPayoutRate();
        entity.fundingCurrency = remittance.getFundingCurrency();
        entity.payoutAmount = remittance.getPayoutAmount();
        entity.fee = remittance.getFee();
        entity.allocatedAmount = BigDecimal.ZERO.setScale(2);
        entity.remainingAmount = remittance.getAmount();
        entity.status = RemittanceStatus.PENDING;
        entity.paidAmount = BigDecimal.ZERO.setScale(2);
        entity.notes = remittance.getNotes();
        entity.idempotencyKey = idempotencyKey;
        entity.createdBy = remittance.getCreatedBy();
        entity.createdAt = remittance.getCreatedAt();
        entity.updatedAt = remittance.getCreatedAt();
        return entity;
    }

    public IncomingRemittance toDomain() {
        return IncomingRemittance.builder()
            .id(id)
            .tenantId(tenantId)
            .branchId(branchId)
            .remittanceCode(remittanceCode)
            .senderName(senderName)
            .senderPhone(senderPhone)
            .senderIban(senderIban)
            .senderBank(senderBank)
            .recipientName(recipientName)
            .recipientPhone(recipientPhone)
            .recipientEmail(recipientEmail)
            .recipientAddress(recipientAddress)
            .currency(currency)
            .amount(amount)
            .payoutRate(payoutRate)
            .fundingCurrency(fundingCurrency)
            .payoutAmount(payoutAmount)
            .fee(fee)
            .allocatedAmount(allocatedAmount)
            .remainingAmount(remainingAmount)
            .status(status)
            .paidAmount(paidAmount)
            .paymentMethod(paymentMethod)
            .paymentReference(paymentReference)
            .notes(notes)
            .createdBy(createdBy)
            .createdAt(createdAt)
            .updatedAt(updatedAt)
            .completedAt(completedAt)
            .paidAt(paidAt)
            .paidBy(paidBy)
            .cancelledAt(cancelledAt)
            .cancelledBy(cancelledBy)
            .cancellationReason(cancellationReason)
            .version(version)
            .build();
    }

    public void ensureOpen() {
        if (status.isTerminal()) {
            throw new InvalidRemittanceStateException(id,
                "Incoming remittance " + remittanceCode + " is " + status + " and cannot be settled");
        }
    }

    public void applyAllocation(BigDecimal allocateAmount, Instant now) {
        ensureOpen();
        if (allocateAmount.compareTo(remainingAmount) > 0) {
            throw new InsufficientFundsException(allocateAmount, remainingAmount);
        }
        this.allocatedAmount = allocatedAmount.add(allocateAmount);
        this.remainingAmount = remainingAmount.subtract(allocateAmount);
        this.status = RemittanceStatus.fromBalances(allocatedAmount, remainingAmount);
        if (status == RemittanceStatus.COMPLETED) {
            this.completedAt = now;
        }
        this.updatedAt = now;
    }

    /**
     * Records the payout to the recipient. Allowed only once the funds are fully settled.
     */
    public void markPaid(UUID actorId, String method, String reference, Instant now) {
        if (status != RemittanceStatus.COMPLETED) {
            throw new InvalidRemittanceStateException(id,
                "Incoming remittance " + remittanceCode + " is " + status + "; only COMPLETED remittances can be paid");
        }
        this.status = RemittanceStatus.PAID;
        this.paidAmount = payoutAmount;
        this.paymentMethod = method;
        this.paymentReference = reference;
        this.paidAt = now;
        this.paidBy = actorId;
        this.updatedAt = now;
    }

    public void cancel(UUID actorId, String reason, Instant now) {
        if (status == RemittanceStatus.CANCELLED) {
            throw new InvalidRemittanceStateException(id, "Incoming remittance " + remittanceCode + " is already cancelled");
        }
        if (status != RemittanceStatus.PENDING || allocatedAmount.signum() > 0) {
            throw new InvalidRemittanceStateException(id,
                "Incoming remittance " + remittanceCode + " has allocated amount " + allocatedAmount.toPlainString()
                    + " and cannot be cancelled");
        }
        this.status = RemittanceStatus.CANCELLED;
        this.cancelledAt = now;
        this.cancelledBy = actorId;
        this.cancellationReason = reason;
        this.updatedAt = now;
    }
}
