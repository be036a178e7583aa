package com.flagship.remittance_ledger.settlement;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.Immutable;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Append-only settlement row. Hibernate never issues an UPDATE for it and a
 * database trigger rejects UPDATE and DELETE as well.
 */
@Entity
@Immutable
@Table(name = "remittance_settlements")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class SettlementEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "tenant_id", nullable = false, updatable = false)
    private UUID tenantId;

    @Column(name = "outgoing_remittance_id", nullable = false, updatable = false)
    private UUID outgoingRemittanceId;

    @Column(name = "incoming_remittance_id", nullable = false, updatable = false)
    private UUID incomingRemittanceId;

    @Column(name = "settled_amount", nullable = false, updatable = false, precision = 20, scale = 2)
    private BigDecimal settledAmount;

    @Column(name = "acquisition_rate", nullable = false, updatable = false, precision = 20, scale = 6)
    private BigDecimal acquisitionRate;

    @Column(name = "payout_rate", nullable = false, updatable = false, precision = 20, scale = 6)
    private BigDecimal payoutRate;

    @Column(nullable = false, updatable = false, precision = 24, scale = 6)
    private BigDecimal profit;

    @Column(updatable = false)
    private String notes;

    @Column(name = "created_by", nullable = false, updatable = false)
    private UUID createdBy;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    static SettlementEntity fromDomain(Settlement settlement) {
        SettlementEntity entity = new SettlementEntity();
        entity.id = settlement.getId();
        entity.tenantId = settlement.getTenantId();
        entity.outgoingRemittanceId = settlement.getOutgoingRemittanceId();
        entity.incomingRemittanceId = settlement.getIncomingRemittanceId();
        entity.settledAmount = settlement.getSettledAmount();
        entity.acquisitionRate = settlement.getAcquisitionRate();
        entity.payoutRate = settlement.getPayoutRate();
        entity.profit = settlement.getProfit();
        entity.notes = settlement.getNotes();
        entity.createdBy = settlement.getCreatedBy();
        entity.createdAt = settlement.getCreatedAt();
        return entity;
    }

    public Settlement toDomain() {
        return Settlement.builder()
            .id(id)
            .tenantId(tenantId)
            .outgoingRemittanceId(outgoingRemittanceId)
            .incomingRemittanceId(incomingRemittanceId)
            .settledAmount(settledAmount)
            .acquisitionRate(acquisitionRate)
            .payoutRate(payoutRate)
            .profit(profit)
            .notes(notes)
            .createdBy(createdBy)
            .createdAt(createdAt)
            .build();
    }
}
