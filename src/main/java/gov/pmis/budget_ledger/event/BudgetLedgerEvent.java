package gov.pmis.budget_ledger.event;

import java.time.Instant;
import java.util.UUID;

/**
 * A fact about a budget line or an approval request, written to the outbox in the
 * same database transaction as the change it describes.
 */
public interface BudgetLedgerEvent {

    String BUDGET_LINE_AGGREGATE = "BudgetLine";
    String APPROVAL_REQUEST_AGGREGATE = "ApprovalRequest";

    /**
     * Unique per event instance; consumers deduplicate on it.
     */
    UUID getEventId();

    /**
     * One of {@link #BUDGET_LINE_AGGREGATE} or {@link #APPROVAL_REQUEST_AGGREGATE}.
     */
    String getAggregateType();

    /**
     * Id of the budget line or approval request. Also the Kafka key.
     */
    UUID getAggregateId();

    String getEventType();

    Instant getOccurredAt();
}
