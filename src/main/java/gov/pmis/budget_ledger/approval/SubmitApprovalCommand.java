package gov.pmis.budget_ledger.approval;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.UUID;

/**
 * Input for {@link ApprovalWorkflowService#submit(SubmitApprovalCommand)}.
 * Empty {@code levels} selects the configured workflow for the entity type.
 */
@Value
@Builder
public class SubmitApprovalCommand {
    ApprovalEntityType entityType;
    UUID entityId;
    UUID requesterId;
    String title;
    @Builder.Default
    List<ApprovalLevel> levels = List.of();
}
