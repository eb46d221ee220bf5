package gov.pmis.budget_ledger.approval.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import gov.pmis.budget_ledger.approval.ApprovalEntityType;
import gov.pmis.budget_ledger.approval.SubmitApprovalCommand;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

import java.util.List;
import java.util.UUID;

/**
 * Omitting {@code levels} selects the configured workflow for the entity type.
 */
@Value
public class SubmitApprovalRequest {

    @NotNull(message = "Entity type is required")
    @JsonProperty("entity_type")
    ApprovalEntityType entityType;

    @NotNull(message = "Entity ID is required")
    @JsonProperty("entity_id")
    UUID entityId;

    @JsonProperty("title")
    String title;

    @Valid
    @JsonProperty("levels")
    List<ApprovalLevelDto> levels;

    public SubmitApprovalCommand toCommand(UUID requesterId) {
        return SubmitApprovalCommand.builder()
            .entityType(entityType)
            .entityId(entityId)
            .requesterId(requesterId)
            .title(title)
            .levels(levels == null ? List.of() : levels.stream().map(ApprovalLevelDto::toLevel).toList())
            .build();
    }
}
