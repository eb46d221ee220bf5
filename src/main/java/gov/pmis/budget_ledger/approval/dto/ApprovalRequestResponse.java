package gov.pmis.budget_ledger.approval.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import gov.pmis.budget_ledger.approval.ApprovalEntityType;
import gov.pmis.budget_ledger.approval.ApprovalLevel;
import gov.pmis.budget_ledger.approval.ApprovalRequest;
import gov.pmis.budget_ledger.approval.ApprovalStatus;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * {@code current_level} and {@code current_role} are null once the request is closed.
 */
@Value
@Builder
public class ApprovalRequestResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("entity_type")
    ApprovalEntityType entityType;

    @JsonProperty("entity_id")
    UUID entityId;

    @JsonProperty("requester_id")
    UUID requesterId;

    @JsonProperty("title")
    String title;

    @JsonProperty("status")
    ApprovalStatus status;

    @JsonProperty("current_level")
    Integer currentLevel;

    @JsonProperty("current_role")
    String currentRole;

    @JsonProperty("levels")
    List<ApprovalLevelDto> levels;

    @JsonProperty("decisions")
    List<ApprovalDecisionResponse> decisions;

    @JsonProperty("closing_reason")
    String closingReason;

    @JsonProperty("created_at")
    Instant createdAt;

    @JsonProperty("updated_at")
    Instant updatedAt;

    @JsonProperty("closed_at")
    Instant closedAt;

    public static ApprovalRequestResponse from(ApprovalRequest request) {
        ApprovalLevel current = request.getCurrentLevel();
        return ApprovalRequestResponse.builder()
            .id(request.getId())
            .entityType(request.getEntityType())
            .entityId(request.getEntityId())
            .requesterId(request.getRequesterId())
            .title(request.getTitle())
            .status(request.getStatus())
            .currentLevel(current == null ? null : current.getOrder())
            .currentRole(current == null ? null : current.getRequiredRole())
            .levels(request.getLevels().stream().map(ApprovalLevelDto::from).toList())
            .decisions(request.getDecisions().stream().map(ApprovalDecisionResponse::from).toList())
            .closingReason(request.getClosingReason())
            .createdAt(request.getCreatedAt())
            .updatedAt(request.getUpdatedAt())
            .closedAt(request.getClosedAt())
            .build();
    }
}
