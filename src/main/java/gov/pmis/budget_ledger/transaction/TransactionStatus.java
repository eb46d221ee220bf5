package gov.pmis.budget_ledger.transaction;

public enum TransactionStatus {
    /**
     * Recorded, counted as committed (debits only). Initial state.
     */
    PENDING,

    /**
     * Folded into spent (debits) or subtracted from it (credits). Terminal.
     */
    APPROVED,

    /**
     * No ledger effect. Terminal.
     */
    REJECTED
}
