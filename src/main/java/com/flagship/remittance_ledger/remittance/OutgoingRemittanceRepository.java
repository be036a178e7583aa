package com.flagship.remittance_ledger.remittance;

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
public interface OutgoingRemittanceRepository extends JpaRepository<OutgoingRemittanceEntity, UUID> {

    Optional<OutgoingRemittanceEntity> findByIdAndTenantId(UUID id, UUID tenantId);

    /**
     * Loads the row under {@code SELECT ... FOR UPDATE}. Always taken before the
     * incoming row of the same settlement.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT o FROM OutgoingRemittanceEntity o WHERE o.id = :id AND o.tenantId = :tenantId")
    Optional<OutgoingRemittanceEntity> findForUpdate(@Param("id") UUID id, @Param("tenantId") UUID tenantId);

    Optional<OutgoingRemittanceEntity> findByTenantIdAndIdempotencyKey(UUID tenantId, String idempotencyKey);

    List<OutgoingRemittanceEntity> findByTenantIdAndStatusInOrderByCreatedAtAscIdAsc(
        UUID tenantId, Collection<RemittanceStatus> statuses);

    List<OutgoingRemittanceEntity> findByTenantIdAndBranchIdAndStatusInOrderByCreatedAtAscIdAsc(
        UUID tenantId, UUID branchId, Collection<RemittanceStatus> statuses);
}
