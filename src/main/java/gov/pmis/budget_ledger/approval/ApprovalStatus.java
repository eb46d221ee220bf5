package gov.pmis.budget_ledger.approval;

/**
 * Lifecycle of an approval request. Only PENDING accepts further decisions.
 */
public enum ApprovalStatus {
    /**
     * Waiting for a decision at the current level.
     */
    PENDING,

    /**
     * Every level approved. Terminal.
     */
    APPROVED,

    /**
     * Rejected at some level; the remaining levels are skipped. Terminal.
     */
    REJECTED,

    /**
     * Withdrawn by the requester before any decision. Terminal.
     */
    CANCELLED;

    public boolean isTerminal() {
        return this != PENDING;
    }
}
