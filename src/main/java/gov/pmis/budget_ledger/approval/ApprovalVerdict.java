package gov.pmis.budget_ledger.approval;

public enum ApprovalVerdict {
    APPROVED,
    REJECTED
}
