package gov.pmis.budget_ledger.event;

import gov.pmis.budget_ledger.transaction.BudgetTransaction;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Published when a transaction leaves PENDING. Carries the line's spent amount
 * right after the decision so consumers need not recompute it.
 */
@Value
public class TransactionDecidedEvent implements BudgetLedgerEvent {
    UUID eventId;
    UUID budgetLineId;
    UUID transactionId;
    String transactionType;
    BigDecimal amount;
    String status;
    UUID decidedBy;
    BigDecimal spentAfterDecision;
    Instant occurredAt;

    public static final String EVENT_TYPE = "TransactionDecided";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    @Override
    public String getAggregateType() {
        return BUDGET_LINE_AGGREGATE;
    }

    @Override
    public UUID getAggregateId() {
        return budgetLineId;
    }

    public static TransactionDecidedEvent fromTransaction(BudgetTransaction transaction, BigDecimal spentAfterDecision) {
        return new TransactionDecidedEvent(
            UUID.randomUUID(),
            transaction.getBudgetLineId(),
            transaction.getId(),
            transaction.getType().name(),
            transaction.getAmount(),
            transaction.getStatus().name(),
            transaction.getDecidedBy(),
            spentAfterDecision,
            Instant.now()
        );
    }
}
