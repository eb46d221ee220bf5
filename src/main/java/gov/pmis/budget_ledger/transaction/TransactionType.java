package gov.pmis.budget_ledger.transaction;

/**
 * Kind of ledger entry. Debits consume budget; credits give it back once approved.
 */
public enum TransactionType {
    EXPENSE(true),
    COMMITMENT(true),
    ADJUSTMENT(false),
    REFUND(false);

    private final boolean debit;

    TransactionType(boolean debit) {
        this.debit = debit;
    }

    /**
     * Debits are checked against available budget when recorded and when approved.
     */
    public boolean isDebit() {
        return debit;
    }
}
