package gov.pmis.budget_ledger.ledger;

/**
 * Result of removing a budget line.
 */
public enum RemovalOutcome {
    /** The line had no transactions and was deleted. */
    DELETED,
    /** The line carries transactions and was soft-closed instead. */
    CLOSED
}
