package gov.pmis.budget_ledger.event;

import gov.pmis.budget_ledger.ledger.BudgetLine;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Published when a budget line is created.
 */
@Value
public class BudgetAllocatedEvent implements BudgetLedgerEvent {
    UUID eventId;
    UUID budgetLineId;
    UUID projectId;
    String category;
    int fiscalYear;
    BigDecimal allocatedAmount;
    UUID allocatedBy;
    Instant occurredAt;

    public static final String EVENT_TYPE = "BudgetAllocated";

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

    public static BudgetAllocatedEvent fromLine(BudgetLine line) {
        return new BudgetAllocatedEvent(
            UUID.randomUUID(),
            line.getId(),
            line.getProjectId(),
            line.getCategory().name(),
            line.getFiscalYear(),
            line.getAllocatedAmount(),
            line.getAllocatedBy(),
            Instant.now()
        );
    }
}
