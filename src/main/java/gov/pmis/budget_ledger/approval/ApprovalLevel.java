package gov.pmis.budget_ledger.approval;

import lombok.Value;

/**
 * One step of a workflow. Orders run 1..N and each level needs one holder of its role.
 */
@Value
public class ApprovalLevel {
    int order;
    String requiredRole;
}
