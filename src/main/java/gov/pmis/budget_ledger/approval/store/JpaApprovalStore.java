package gov.pmis.budget_ledger.approval.store;

import gov.pmis.budget_ledger.approval.ApprovalEntityType;
import gov.pmis.budget_ledger.approval.ApprovalRequest;
import gov.pmis.budget_ledger.approval.ApprovalStatus;
import gov.pmis.budget_ledger.exception.NotFoundException;
import gov.pmis.budget_ledger.persistence.LockRetryTemplate;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Function;

@Repository
@RequiredArgsConstructor
public class JpaApprovalStore implements ApprovalStore {

    private final ApprovalRequestRepository repository;
    private final LockRetryTemplate lockRetryTemplate;

    @Override
    @Transactional
    public ApprovalRequest insert(ApprovalRequest request) {
        return repository.save(ApprovalRequestEntity.fromDomain(request)).toDomain();
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<ApprovalRequest> findById(UUID requestId) {
        return repository.findById(requestId).map(ApprovalRequestEntity::toDomain);
    }

    @Override
    public <T> T inRequestLock(UUID requestId, Function<ApprovalRequest, T> work) {
        return lockRetryTemplate.execute(requestId, status -> {
            ApprovalRequestEntity locked = repository.findByIdForUpdate(requestId)
                .orElseThrow(() -> new NotFoundException(ApprovalRequest.RESOURCE, requestId));
            return work.apply(locked.toDomain());
        });
    }

    @Override
    @Transactional
    public ApprovalRequest update(ApprovalRequest request) {
        ApprovalRequestEntity entity = repository.findById(request.getId())
            .orElseThrow(() -> new NotFoundException(ApprovalRequest.RESOURCE, request.getId()));
        entity.updateFromDomain(request);
        return repository.save(entity).toDomain();
    }

    @Override
    @Transactional(readOnly = true)
    public List<ApprovalRequest> findPending() {
        return repository.findByStatusOrderByCreatedAtAsc(ApprovalStatus.PENDING).stream()
            .map(ApprovalRequestEntity::toDomain)
            .toList();
    }

    @Override
    @Transactional(readOnly = true)
    public List<ApprovalRequest> findByEntity(ApprovalEntityType entityType, UUID entityId) {
        return repository.findByEntityTypeAndEntityIdOrderByCreatedAtAsc(entityType, entityId).stream()
            .map(ApprovalRequestEntity::toDomain)
            .toList();
    }

    @Override
    @Transactional(readOnly = true)
    public Map<ApprovalStatus, Long> countByStatus() {
        Map<ApprovalStatus, Long> counts = new EnumMap<>(ApprovalStatus.class);
        for (Object[] row : repository.countGroupedByStatus()) {
            counts.put((ApprovalStatus) row[0], ((Number) row[1]).longValue());
        }
        return counts;
    }
}
