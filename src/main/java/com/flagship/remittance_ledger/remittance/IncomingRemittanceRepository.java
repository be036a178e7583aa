package com.flagship.remittance_ledger.remittance;

import com.flagship.remittance_ledger.common.CurrencyCode;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface IncomingRemittanceRepository extends JpaRepository<IncomingRemittanceEntity, UUID> {

    Optional<IncomingRemittanceEntity> findByIdAndTenantId(UUID id, UUID tenantId);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT i FROM IncomingRemittanceEntity i WHERE i.id = :id AND i.tenantId = :tenantId")
    Optional<IncomingRemittanceEntity> findForUpdate(@Param("id") UUID id, @Param("tenantId") UUID tenantId);

    Optional<IncomingRemittanceEntity> findByTenantIdAndIdempotencyKey(UUID tenantId, String idempotencyKey);

    List<IncomingRemittanceEntity> findByTenantIdAndStatusInOrderByCreatedAtAscIdAsc(
        UUID tenantId, Collection<RemittanceStatus> statuses);

    List<IncomingRemittanceEntity> findByTenantIdAndBranchIdAndStatusInOrderByCreatedAtAscIdAsc(
        UUID tenantId, UUID branchId, Collection<RemittanceStatus> statuses);

    /**
     * Open funds in one debt currency. Read without locks; ordering is left to the strategy.
     */
    @Query("""
        SELECT i FROM IncomingRemittanceEntity i
        WHERE i.tenantId = :tenantId
          AND i.currency = :currency
          AND i.status IN (com.flagship.remittance_ledger.remittance.RemittanceStatus.PENDING,
                           com.flagship.remittance_ledger.remittance.RemittanceStatus.PARTIAL)
          AND i.remainingAmount > 0
        """)
    List<IncomingRemittanceEntity> findSettlementCandidates(@Param("tenantId") UUID tenantId,
                                                            @Param("currency") CurrencyCode currency);
}
