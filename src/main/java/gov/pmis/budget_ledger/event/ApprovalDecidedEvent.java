package gov.pmis.budget_ledger.event;

import gov.pmis.budget_ledger.approval.ApprovalRequest;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Published when an approval request reaches a terminal state. This is how owners of
 * projects, budgets and purchase orders learn the outcome of their requests.
 */
@Value
public class ApprovalDecidedEvent implements BudgetLedgerEvent {
    UUID eventId;
    UUID approvalRequestId;
    String entityType;
    UUID entityId;
    String status;
    UUID requesterId;
    String closingReason;
    Instant occurredAt;

    public static final String EVENT_TYPE = "ApprovalDecided";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    @Override
    public String getAggregateType() {
        return APPROVAL_REQUEST_AGGREGATE;
    }

    @Override
    public UUID getAggregateId() {
        return approvalRequestId;
    }

    public static ApprovalDecidedEvent fromRequest(ApprovalRequest request) {
        return new ApprovalDecidedEvent(
            UUID.randomUUID(),
            request.getId(),
            request.getEntityType().name(),
            request.getEntityId(),
            request.getStatus().name(),
            request.getRequesterId(),
            request.getClosingReason(),
            Instant.now()
        );
    }
}
