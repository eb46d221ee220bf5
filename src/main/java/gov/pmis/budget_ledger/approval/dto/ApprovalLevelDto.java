package gov.pmis.budget_ledger.approval.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import gov.pmis.budget_ledger.approval.ApprovalLevel;
import jakarta.validation.constraints.NotBlank;
import lombok.Value;

@Value
public class ApprovalLevelDto {

    @JsonProperty("order")
    int order;

    @NotBlank(message = "Required role is required")
    @JsonProperty("required_role")
    String requiredRole;

    public ApprovalLevel toLevel() {
        return new ApprovalLevel(order, requiredRole);
    }

    public static ApprovalLevelDto from(ApprovalLevel level) {
        return new ApprovalLevelDto(level.getOrder(), level.getRequiredRole());
    }
}
