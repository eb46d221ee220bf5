package gov.pmis.budget_ledger.approval;

import gov.pmis.budget_ledger.exception.AlreadyProcessedException;
import gov.pmis.budget_ledger.exception.CannotCancelException;
import gov.pmis.budget_ledger.exception.UnauthorizedApproverException;
import gov.pmis.budget_ledger.exception.UnauthorizedCancelException;
import lombok.Value;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * A sequential, role-gated approval over one entity.
 *
 * Levels are decided strictly in order. Approving the last level closes the request
 * as APPROVED; a rejection at any level closes it as REJECTED; the requester may
 * cancel only while no decision has been recorded. Every transition returns a new
 * instance with the decision appended to the audit log.
 */
@Value
public class ApprovalRequest {
    public static final String RESOURCE = "Approval request";

    UUID id;
    ApprovalEntityType entityType;
    UUID entityId;
    UUID requesterId;
    String title;
    List<ApprovalLevel> levels;
    int currentLevelIndex;
    ApprovalStatus status;
    List<ApprovalDecision> decisions;
    String closingReason;
    Instant createdAt;
    Instant updatedAt;
    Instant closedAt;

    /**
     * Opens a request at the first level.
     *
     * @param levels validated levels, already ordered 1..N
     */
    public static ApprovalRequest submit(ApprovalEntityType entityType, UUID entityId, UUID requesterId,
                                         String title, List<ApprovalLevel> levels, Instant now) {
        return new ApprovalRequest(
            UUID.randomUUID(),
            entityType,
            entityId,
            requesterId,
            title,
            List.copyOf(levels),
            0,
            ApprovalStatus.PENDING,
            List.of(),
            null,
            now,
            now,
            null
        );
    }

    /**
     * Level awaiting a decision, or null once the request is closed.
     */
    public ApprovalLevel getCurrentLevel() {
        return status == ApprovalStatus.PENDING ? levels.get(currentLevelIndex) : null;
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }

    public boolean isFinalLevel() {
        return currentLevelIndex == levels.size() - 1;
    }

    /**
     * @throws AlreadyProcessedException if the request is closed
     * @throws UnauthorizedApproverException if the approver lacks the current level's role
     */
    public ApprovalRequest approve(Approver approver, String comment, Instant now) {
        ApprovalLevel level = requireDecidableBy(approver);
        List<ApprovalDecision> log = append(level, approver, ApprovalVerdict.APPROVED, comment, now);

        if (isFinalLevel()) {
            return new ApprovalRequest(id, entityType, entityId, requesterId, title, levels,
                currentLevelIndex, ApprovalStatus.APPROVED, log, null, createdAt, now, now);
        }
        return new ApprovalRequest(id, entityType, entityId, requesterId, title, levels,
            currentLevelIndex + 1, ApprovalStatus.PENDING, log, null, createdAt, now, null);
    }

    /**
     * Rejects at the current level and closes the request. The comment becomes the closing reason.
     *
     * @throws AlreadyProcessedException if the request is closed
     * @throws UnauthorizedApproverException if the approver lacks the current level's role
     */
    public ApprovalRequest reject(Approver approver, String comment, Instant now) {
        ApprovalLevel level = requireDecidableBy(approver);
        List<ApprovalDecision> log = append(level, approver, ApprovalVerdict.REJECTED, comment, now);

        return new ApprovalRequest(id, entityType, entityId, requesterId, title, levels,
            currentLevelIndex, ApprovalStatus.REJECTED, log, comment, createdAt, now, now);
    }

    /**
     * @throws UnauthorizedCancelException if the caller is not the requester
     * @throws CannotCancelException if the request is closed or a level has already decided
     */
    public ApprovalRequest cancel(UUID callerId, String reason, Instant now) {
        if (!requesterId.equals(callerId)) {
            throw new UnauthorizedCancelException(id);
        }
        if (status != ApprovalStatus.PENDING) {
            throw new CannotCancelException(id, "request is " + status);
        }
        if (!decisions.isEmpty()) {
            throw new CannotCancelException(id, "a decision has already been recorded");
        }
        return new ApprovalRequest(id, entityType, entityId, requesterId, title, levels,
            currentLevelIndex, ApprovalStatus.CANCELLED, decisions, reason, createdAt, now, now);
    }

    private ApprovalLevel requireDecidableBy(Approver approver) {
        if (status.isTerminal()) {
            throw new AlreadyProcessedException(RESOURCE, id, status);
        }
        ApprovalLevel level = levels.get(currentLevelIndex);
        if (!approver.hasRole(level.getRequiredRole())) {
            throw new UnauthorizedApproverException(id, level.getRequiredRole());
        }
        return level;
    }

    private List<ApprovalDecision> append(ApprovalLevel level, Approver approver, ApprovalVerdict verdict,
                                          String comment, Instant now) {
        List<ApprovalDecision> log = new ArrayList<>(decisions);
        log.add(new ApprovalDecision(level.getOrder(), level.getRequiredRole(), approver.getUserId(),
            verdict, comment, now));
        return List.copyOf(log);
    }
}
