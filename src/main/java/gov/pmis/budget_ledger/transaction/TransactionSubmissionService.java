package gov.pmis.budget_ledger.transaction;

import gov.pmis.budget_ledger.approval.ApprovalEntityType;
import gov.pmis.budget_ledger.approval.ApprovalRequest;
import gov.pmis.budget_ledger.approval.ApprovalWorkflowService;
import gov.pmis.budget_ledger.approval.Approver;
import gov.pmis.budget_ledger.approval.SubmitApprovalCommand;
import gov.pmis.budget_ledger.exception.ConflictException;
import gov.pmis.budget_ledger.exception.UnauthorizedApproverException;
import gov.pmis.budget_ledger.exception.ValidationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Entry point for transactions arriving over the API.
 *
 * Records the transaction and, when {@link TransactionApprovalPolicy} requires it,
 * opens the TRANSACTION approval request in the same database transaction. The
 * request's outcome is applied later by {@link TransactionApprovalListener}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TransactionSubmissionService {

    private final TransactionProcessor processor;
    private final ApprovalWorkflowService workflowService;
    private final TransactionApprovalPolicy policy;
    private final TransactionIdempotencyService idempotencyService;

    @Transactional
    public TransactionSubmission submit(RecordTransactionCommand command) {
        String key = command.getIdempotencyKey();
        if (key == null || key.isBlank()) {
            throw new ValidationException("Idempotency-Key is required");
        }

        Optional<BudgetTransaction> cached = idempotencyService.lookup(key).flatMap(processor::findTransaction);
        if (cached.isPresent()) {
            BudgetTransaction replay = cached.get();
            if (!replay.getBudgetLineId().equals(command.getBudgetLineId())) {
                throw new ConflictException("Idempotency key was already used on another budget line",
                    Map.of("idempotencyKey", key));
            }
            log.info("Idempotent replay of transaction {}", replay.getId());
            return new TransactionSubmission(replay, true, gatingRequestId(replay.getId()));
        }

        RecordOutcome outcome = processor.record(command);
        BudgetTransaction transaction = outcome.getTransaction();
        if (outcome.isReplayed()) {
            return new TransactionSubmission(transaction, true, gatingRequestId(transaction.getId()));
        }

        UUID approvalRequestId = null;
        if (policy.requiresApproval(transaction)) {
            ApprovalRequest request = workflowService.submit(SubmitApprovalCommand.builder()
                .entityType(ApprovalEntityType.TRANSACTION)
                .entityId(transaction.getId())
                .requesterId(command.getCreatedBy())
                .title(transaction.getType() + " " + transaction.getAmount() + ": " + transaction.getDescription())
                .levels(policy.levelsFor(transaction))
                .build());
            approvalRequestId = request.getId();
            log.info("Transaction {} gated by approval request {}", transaction.getId(), approvalRequestId);
        }

        rememberAfterCommit(key, transaction.getId());
        return new TransactionSubmission(transaction, false, approvalRequestId);
    }

    /**
     * Decides a transaction that no approval request gates.
     *
     * @throws UnauthorizedApproverException when the caller holds no direct-decision role
     * @throws ConflictException while an approval request for the transaction is PENDING
     */
    public BudgetTransaction decide(UUID transactionId, TransactionDecision decision, Approver approver,
                                    String comment) {
        if (approver == null || approver.getUserId() == null) {
            throw new ValidationException("Approver identity is required");
        }
        if (!policy.canDecideDirectly(approver)) {
            throw new UnauthorizedApproverException(transactionId, policy.directDecisionRole());
        }
        if (workflowService.hasPendingRequest(ApprovalEntityType.TRANSACTION, transactionId)) {
            throw new ConflictException("Transaction is awaiting its approval request: " + transactionId);
        }
        return processor.decide(transactionId, decision, approver.getUserId(), comment);
    }

    private UUID gatingRequestId(UUID transactionId) {
        List<ApprovalRequest> requests = workflowService.findByEntity(ApprovalEntityType.TRANSACTION, transactionId);
        return requests.isEmpty() ? null : requests.get(requests.size() - 1).getId();
    }

    private void rememberAfterCommit(String key, UUID transactionId) {
        if (!TransactionSynchronizationManager.isSynchronizationActive()) {
            idempotencyService.remember(key, transactionId);
            return;
        }
        TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
            @Override
            public void afterCommit() {
                idempotencyService.remember(key, transactionId);
            }
        });
    }
}
