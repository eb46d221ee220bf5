package gov.pmis.budget_ledger.approval.store;

import gov.pmis.budget_ledger.approval.ApprovalEntityType;
import gov.pmis.budget_ledger.approval.ApprovalStatus;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface ApprovalRequestRepository extends JpaRepository<ApprovalRequestEntity, UUID> {

    /**
     * Loads a request with a row lock held until the transaction ends.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT r FROM ApprovalRequestEntity r WHERE r.id = :id")
    Optional<ApprovalRequestEntity> findByIdForUpdate(@Param("id") UUID id);

    List<ApprovalRequestEntity> findByStatusOrderByCreatedAtAsc(ApprovalStatus status);

    List<ApprovalRequestEntity> findByEntityTypeAndEntityIdOrderByCreatedAtAsc(ApprovalEntityType entityType,
                                                                               UUID entityId);

    @Query("SELECT r.status, COUNT(r) FROM ApprovalRequestEntity r GROUP BY r.status")
    List<Object[]> countGroupedByStatus();
}
