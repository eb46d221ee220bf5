package gov.pmis.budget_ledger.approval.store;

import gov.pmis.budget_ledger.approval.ApprovalDecision;
import gov.pmis.budget_ledger.approval.ApprovalVerdict;
import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

@Embeddable
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class ApprovalDecisionEmbeddable {

    @Column(name = "level_order", nullable = false)
    private int levelOrder;

    @Column(name = "required_role", nullable = false, length = 64)
    private String requiredRole;

    @Column(name = "approver_id", nullable = false)
    private UUID approverId;

    @Enumerated(EnumType.STRING)
    @Column(name = "decision", nullable = false, length = 16)
    private ApprovalVerdict verdict;

    @Column(name = "comment", columnDefinition = "TEXT")
    private String comment;

    @Column(name = "decided_at", nullable = false)
    private Instant decidedAt;

    static ApprovalDecisionEmbeddable fromDomain(ApprovalDecision decision) {
        ApprovalDecisionEmbeddable embeddable = new ApprovalDecisionEmbeddable();
        embeddable.levelOrder = decision.getLevelOrder();
        embeddable.requiredRole = decision.getRequiredRole();
        embeddable.approverId = decision.getApproverId();
        embeddable.verdict = decision.getVerdict();
        embeddable.comment = decision.getComment();
        embeddable.decidedAt = decision.getDecidedAt();
        return embeddable;
    }

    ApprovalDecision toDomain() {
        return new ApprovalDecision(levelOrder, requiredRole, approverId, verdict, comment, decidedAt);
    }
}
