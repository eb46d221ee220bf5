package gov.pmis.budget_ledger.approval;

import gov.pmis.budget_ledger.approval.store.ApprovalStore;
import gov.pmis.budget_ledger.event.ApprovalDecidedEvent;
import gov.pmis.budget_ledger.exception.NotFoundException;
import gov.pmis.budget_ledger.exception.ValidationException;
import gov.pmis.budget_ledger.observability.BudgetMetrics;
import gov.pmis.budget_ledger.observability.CorrelationContext;
import gov.pmis.budget_ledger.outbox.OutboxService;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.UUID;
import java.util.function.Function;

/**
 * Sequential, role-gated approval workflow shared by projects, budgets, purchase
 * orders and transactions.
 *
 * Every decision runs under the request's row lock, so two approvers racing on the
 * same level cannot both succeed: the second sees the advanced level (and fails the
 * role check) or the closed request ({@code ALREADY_PROCESSED}). When a request closes,
 * registered {@link ApprovalOutcomeListener}s run inside the same lock and
 * transaction, then an {@code ApprovalDecided} event is written to the outbox.
 *
 * Lock order is request first, then (through a listener) budget line.
 */
@Service
@Slf4j
public class ApprovalWorkflowService {

    private final ApprovalStore store;
    private final ApprovalProperties properties;
    private final List<ApprovalOutcomeListener> listeners;
    private final OutboxService outboxService;
    private final BudgetMetrics metrics;
    private final Clock clock;

    public ApprovalWorkflowService(ApprovalStore store,
                                   ApprovalProperties properties,
                                   List<ApprovalOutcomeListener> listeners,
                                   OutboxService outboxService,
                                   BudgetMetrics metrics,
                                   Clock clock) {
        this.store = store;
        this.properties = properties;
        this.listeners = List.copyOf(listeners);
        this.outboxService = outboxService;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Opens a request at its first level.
     *
     * Levels may be given in any order but must number exactly 1..N, each with a
     * non-blank role. No levels selects the configured workflow for the entity type.
     * Listeners for the entity type may refuse the target before anything is stored.
     *
     * @throws ValidationException on malformed input or when no workflow applies
     */
    @Transactional
    public ApprovalRequest submit(SubmitApprovalCommand command) {
        List<String> violations = new ArrayList<>();
        if (command.getEntityType() == null) {
            violations.add("entityType is required");
        }
        if (command.getEntityId() == null) {
            violations.add("entityId is required");
        }
        if (command.getRequesterId() == null) {
            violations.add("requesterId is required");
        }
        if (!violations.isEmpty()) {
            throw new ValidationException("Invalid approval submission", violations);
        }

        List<ApprovalLevel> levels = command.getLevels() == null || command.getLevels().isEmpty()
            ? properties.workflowFor(command.getEntityType())
            : validateLevels(command.getLevels());

        if (levels.isEmpty()) {
            throw new ValidationException("No approval workflow configured for " + command.getEntityType());
        }

        for (ApprovalOutcomeListener listener : listeners) {
            if (listener.supports(command.getEntityType())) {
                listener.checkSubmittable(command.getEntityId());
            }
        }

        ApprovalRequest request = store.insert(ApprovalRequest.submit(
            command.getEntityType(),
            command.getEntityId(),
            command.getRequesterId(),
            command.getTitle(),
            levels,
            now()
        ));

        metrics.recordApprovalSubmitted(request.getEntityType().name());
        log.info("Approval request submitted: requestId={}, entityType={}, entityId={}, levels={}",
            request.getId(), request.getEntityType(), request.getEntityId(), levels.size());

        return request;
    }

    /**
     * Approves the current level; the last level closes the request as APPROVED.
     */
    public ApprovalRequest approve(UUID requestId, Approver approver, String comment) {
        requireApprover(approver);
        return decide(requestId, current -> current.approve(approver, comment, now()), "approved");
    }

    /**
     * Rejects at the current level and closes the request.
     *
     * @throws ValidationException when the comment is blank
     */
    public ApprovalRequest reject(UUID requestId, Approver approver, String comment) {
        if (comment == null || comment.isBlank()) {
            throw new ValidationException("A comment is required to reject an approval request");
        }
        requireApprover(approver);
        return decide(requestId, current -> current.reject(approver, comment, now()), "rejected");
    }

    /**
     * Withdraws a request that no level has decided yet. Only the requester may cancel.
     */
    public ApprovalRequest cancel(UUID requestId, UUID requesterId, String reason) {
        if (requesterId == null) {
            throw new ValidationException("requesterId is required");
        }
        return decide(requestId, current -> current.cancel(requesterId, reason, now()), "cancelled");
    }

    public ApprovalRequest getRequest(UUID requestId) {
        return store.findById(requestId)
            .orElseThrow(() -> new NotFoundException(ApprovalRequest.RESOURCE, requestId));
    }

    public List<ApprovalDecision> getHistory(UUID requestId) {
        return getRequest(requestId).getDecisions();
    }

    /**
     * PENDING requests whose current level the approver can decide, oldest first.
     */
    public List<ApprovalRequest> findPendingFor(Approver approver) {
        return store.findPending().stream()
            .filter(request -> approver.hasRole(request.getCurrentLevel().getRequiredRole()))
            .sorted(Comparator.comparing(ApprovalRequest::getCreatedAt))
            .toList();
    }

    public List<ApprovalRequest> findByEntity(ApprovalEntityType entityType, UUID entityId) {
        return store.findByEntity(entityType, entityId);
    }

    public boolean hasPendingRequest(ApprovalEntityType entityType, UUID entityId) {
        return store.findByEntity(entityType, entityId).stream()
            .anyMatch(request -> request.getStatus() == ApprovalStatus.PENDING);
    }

    /**
     * Default workflow for an entity type.
     *
     * @throws NotFoundException when none is configured
     */
    public List<ApprovalLevel> getWorkflow(ApprovalEntityType entityType) {
        List<ApprovalLevel> levels = properties.workflowFor(entityType);
        if (levels.isEmpty()) {
            throw new NotFoundException("Approval workflow", entityType);
        }
        return levels;
    }

    public ApprovalStatistics statistics() {
        return ApprovalStatistics.from(store.countByStatus());
    }

    private ApprovalRequest decide(UUID requestId, Function<ApprovalRequest, ApprovalRequest> transition,
                                   String action) {
        MDC.put(CorrelationContext.APPROVAL_REQUEST_ID_MDC_KEY, requestId.toString());
        try {
            return store.inRequestLock(requestId, current -> {
                ApprovalRequest next = transition.apply(current);
                if (next.isTerminal()) {
                    close(next);
                }
                ApprovalRequest saved = store.update(next);
                log.info("Approval request {}: status={}, level={}/{}",
                    action, saved.getStatus(), saved.getCurrentLevelIndex() + 1, saved.getLevels().size());
                return saved;
            });
        } finally {
            MDC.remove(CorrelationContext.APPROVAL_REQUEST_ID_MDC_KEY);
        }
    }

    private void close(ApprovalRequest closed) {
        for (ApprovalOutcomeListener listener : listeners) {
            if (listener.supports(closed.getEntityType())) {
                listener.onClosed(closed);
            }
        }
        outboxService.saveEvent(ApprovalDecidedEvent.fromRequest(closed));
        metrics.recordApprovalClosed(closed.getEntityType().name(), closed.getStatus().name());
    }

    private static List<ApprovalLevel> validateLevels(List<ApprovalLevel> levels) {
        List<ApprovalLevel> sorted = levels.stream()
            .sorted(Comparator.comparingInt(ApprovalLevel::getOrder))
            .toList();

        List<String> violations = new ArrayList<>();
        for (int i = 0; i < sorted.size(); i++) {
            ApprovalLevel level = sorted.get(i);
            if (level.getOrder() != i + 1) {
                violations.add(String.format("level orders must be exactly 1..%d, found %d at position %d",
                    sorted.size(), level.getOrder(), i + 1));
            }
            if (level.getRequiredRole() == null || level.getRequiredRole().isBlank()) {
                violations.add(String.format("level %d has no required role", level.getOrder()));
            }
        }
        if (!violations.isEmpty()) {
            throw new ValidationException("Invalid approval levels", violations);
        }

        return sorted.stream()
            .map(level -> new ApprovalLevel(level.getOrder(), level.getRequiredRole().trim()))
            .toList();
    }

    private static void requireApprover(Approver approver) {
        if (approver == null || approver.getUserId() == null) {
            throw new ValidationException("Approver identity is required");
        }
    }

    private Instant now() {
        return Instant.now(clock);
    }
}
