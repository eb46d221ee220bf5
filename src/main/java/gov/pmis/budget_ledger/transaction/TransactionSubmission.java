package gov.pmis.budget_ledger.transaction;

import lombok.Value;

import java.util.UUID;

/**
 * Result of submitting a transaction: the transaction, whether it was an idempotent
 * replay, and the approval request gating it (null when none).
 */
@Value
public class TransactionSubmission {
    BudgetTransaction transaction;
    boolean replayed;
    UUID approvalRequestId;
}
