package gov.pmis.budget_ledger.transaction;

import lombok.Value;

/**
 * A recorded transaction, and whether it was returned for a repeated idempotency key
 * instead of being inserted.
 */
@Value
public class RecordOutcome {
    BudgetTransaction transaction;
    boolean replayed;

    public static RecordOutcome inserted(BudgetTransaction transaction) {
        return new RecordOutcome(transaction, false);
    }

    public static RecordOutcome replayed(BudgetTransaction transaction) {
        return new RecordOutcome(transaction, true);
    }
}
