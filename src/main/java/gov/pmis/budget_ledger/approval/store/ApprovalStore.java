package gov.pmis.budget_ledger.approval.store;

import gov.pmis.budget_ledger.approval.ApprovalEntityType;
import gov.pmis.budget_ledger.approval.ApprovalRequest;
import gov.pmis.budget_ledger.approval.ApprovalStatus;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Function;

/**
 * Persistence collaborator for approval requests and their decision logs.
 */
public interface ApprovalStore {

    ApprovalRequest insert(ApprovalRequest request);

    Optional<ApprovalRequest> findById(UUID requestId);

    /**
     * Loads the request under an exclusive lock and applies {@code work} to it. Decisions
     * on one request are serialized through this lock; work that changes the request
     * must call {@link #update(ApprovalRequest)} before returning.
     *
     * @throws gov.pmis.budget_ledger.exception.NotFoundException when the request does not exist
     * @throws gov.pmis.budget_ledger.exception.LedgerContentionException when the lock
     *         cannot be acquired within the configured wait
     */
    <T> T inRequestLock(UUID requestId, Function<ApprovalRequest, T> work);

    /**
     * Saves status, level and closing fields and appends decisions not yet stored.
     */
    ApprovalRequest update(ApprovalRequest request);

    /**
     * PENDING requests, oldest first.
     */
    List<ApprovalRequest> findPending();

    /**
     * All requests ever opened for an entity, oldest first.
     */
    List<ApprovalRequest> findByEntity(ApprovalEntityType entityType, UUID entityId);

    Map<ApprovalStatus, Long> countByStatus();
}
