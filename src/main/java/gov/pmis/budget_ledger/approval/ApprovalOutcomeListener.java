package gov.pmis.budget_ledger.approval;

import java.util.UUID;

/**
 * Reacts to an approval request reaching a terminal state.
 *
 * Called while the request is still locked and before its final state is saved, in the
 * same transaction. Throwing aborts the decision: the request stays as it was.
 */
public interface ApprovalOutcomeListener {

    boolean supports(ApprovalEntityType entityType);

    /**
     * Checked before a request for {@code entityId} is opened. Throw to refuse a
     * request whose target can no longer take an outcome.
     */
    default void checkSubmittable(UUID entityId) {
    }

    void onClosed(ApprovalRequest request);
}
