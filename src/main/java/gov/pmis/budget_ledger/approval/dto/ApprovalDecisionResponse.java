package gov.pmis.budget_ledger.approval.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import gov.pmis.budget_ledger.approval.ApprovalDecision;
import gov.pmis.budget_ledger.approval.ApprovalVerdict;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
public class ApprovalDecisionResponse {

    @JsonProperty("level")
    int level;

    @JsonProperty("required_role")
    String requiredRole;

    @JsonProperty("approver_id")
    UUID approverId;

    @JsonProperty("decision")
    ApprovalVerdict decision;

    @JsonProperty("comment")
    String comment;

    @JsonProperty("decided_at")
    Instant decidedAt;

    public static ApprovalDecisionResponse from(ApprovalDecision decision) {
        return new ApprovalDecisionResponse(
            decision.getLevelOrder(),
            decision.getRequiredRole(),
            decision.getApproverId(),
            decision.getVerdict(),
            decision.getComment(),
            decision.getDecidedAt()
        );
    }
}
