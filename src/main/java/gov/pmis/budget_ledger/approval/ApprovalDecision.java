package gov.pmis.budget_ledger.approval;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Audit entry for a decision taken at one level.
 */
@Value
public class ApprovalDecision {
    int levelOrder;
    String requiredRole;
    UUID approverId;
    ApprovalVerdict verdict;
    String comment;
    Instant decidedAt;
}
