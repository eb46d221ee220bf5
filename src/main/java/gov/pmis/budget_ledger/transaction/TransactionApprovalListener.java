package gov.pmis.budget_ledger.transaction;

import gov.pmis.budget_ledger.approval.ApprovalDecision;
import gov.pmis.budget_ledger.approval.ApprovalEntityType;
import gov.pmis.budget_ledger.approval.ApprovalOutcomeListener;
import gov.pmis.budget_ledger.approval.ApprovalRequest;
import gov.pmis.budget_ledger.exception.ConflictException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Applies a closed TRANSACTION approval request to its transaction.
 *
 * Runs inside the request lock, so the line lock taken by the processor nests
 * under it. A failure here (for example the approval would overspend the line)
 * aborts the final approval and leaves the request at its last level. A transaction
 * that is gone or already decided is left alone so the request can still close.
 * Requests are only opened for transactions that are still PENDING.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class TransactionApprovalListener implements ApprovalOutcomeListener {

    private final TransactionProcessor processor;

    @Override
    public boolean supports(ApprovalEntityType entityType) {
        return entityType == ApprovalEntityType.TRANSACTION;
    }

    @Override
    public void checkSubmittable(UUID transactionId) {
        BudgetTransaction transaction = processor.getTransaction(transactionId);
        if (!transaction.isPending()) {
            throw new ConflictException("Transaction has already been decided",
                Map.of("transactionId", transactionId, "status", transaction.getStatus().name()));
        }
    }

    @Override
    public void onClosed(ApprovalRequest request) {
        UUID transactionId = request.getEntityId();
        Optional<BudgetTransaction> transaction = processor.findTransaction(transactionId);
        if (transaction.isEmpty() || !transaction.get().isPending()) {
            log.warn("Transaction {} is missing or already decided; approval request {} closed as {} without effect",
                transactionId, request.getId(), request.getStatus());
            return;
        }

        switch (request.getStatus()) {
            case APPROVED -> processor.decide(transactionId, TransactionDecision.APPROVED,
                lastApprover(request), "Approved through approval request " + request.getId());
            case REJECTED -> processor.decide(transactionId, TransactionDecision.REJECTED,
                lastApprover(request), request.getClosingReason());
            case CANCELLED -> processor.decide(transactionId, TransactionDecision.REJECTED,
                request.getRequesterId(), cancellationComment(request));
            default -> throw new IllegalStateException("Request is not closed: " + request.getStatus());
        }
    }

    private static String cancellationComment(ApprovalRequest request) {
        String reason = request.getClosingReason();
        return reason == null || reason.isBlank() ? "Approval request cancelled" : "Approval request cancelled: " + reason;
    }

    private static UUID lastApprover(ApprovalRequest request) {
        List<ApprovalDecision> decisions = request.getDecisions();
        return decisions.isEmpty() ? request.getRequesterId() : decisions.get(decisions.size() - 1).getApproverId();
    }
}
