package gov.pmis.budget_ledger.approval;

/**
 * Kinds of entity that can be routed through an approval workflow.
 * Requests reference their target by id only.
 */
public enum ApprovalEntityType {
    PROJECT,
    BUDGET,
    PURCHASE_ORDER,
    TRANSACTION
}
