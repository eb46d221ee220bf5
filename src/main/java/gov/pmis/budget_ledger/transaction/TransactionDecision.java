package gov.pmis.budget_ledger.transaction;

public enum TransactionDecision {
    APPROVED,
    REJECTED
}
