package com.flagship.remittance_ledger.settlement;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

@Repository
public interface SettlementRepository extends JpaRepository<SettlementEntity, UUID> {

    /**
     * Settlements touching the remittance on either side, oldest first.
     */
    @Query("""
        SELECT s FROM SettlementEntity s
        WHERE s.tenantId = :tenantId
          AND (s.outgoingRemittanceId = :remittanceId OR s.incomingRemittanceId = :remittanceId)
        ORDER BY s.createdAt ASC, s.id ASC
        """)
    List<SettlementEntity> findHistory(@Param("tenantId") UUID tenantId, @Param("remittanceId") UUID remittanceId);

    @Query("SELECT COALESCE(SUM(s.settledAmount), 0) FROM SettlementEntity s WHERE s.outgoingRemittanceId = :outgoingId")
    BigDecimal sumSettledForOutgoing(@Param("outgoingId") UUID outgoingId);

    @Query("SELECT COALESCE(SUM(s.settledAmount), 0) FROM SettlementEntity s WHERE s.incomingRemittanceId = :incomingId")
    BigDecimal sumSettledForIncoming(@Param("incomingId") UUID incomingId);
}
