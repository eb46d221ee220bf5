package gov.pmis.budget_ledger.ledger;

public enum BudgetLineStatus {
    /**
     * Accepts new transactions.
     */
    ACTIVE,

    /**
     * Soft-closed. Keeps its transaction history but accepts no new transactions.
     */
    CLOSED
}
