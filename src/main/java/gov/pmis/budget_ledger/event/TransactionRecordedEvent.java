package gov.pmis.budget_ledger.event;

import gov.pmis.budget_ledger.transaction.BudgetTransaction;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Published when a PENDING transaction is recorded against a budget line.
 */
@Value
public class TransactionRecordedEvent implements BudgetLedgerEvent {
    UUID eventId;
    UUID budgetLineId;
    UUID transactionId;
    String transactionType;
    BigDecimal amount;
    UUID vendorId;
    LocalDate transactionDate;
    UUID createdBy;
    Instant occurredAt;

    public static final String EVENT_TYPE = "TransactionRecorded";

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

    public static TransactionRecordedEvent fromTransaction(BudgetTransaction transaction) {
        return new TransactionRecordedEvent(
            UUID.randomUUID(),
            transaction.getBudgetLineId(),
            transaction.getId(),
            transaction.getType().name(),
            transaction.getAmount(),
            transaction.getVendorId(),
            transaction.getTransactionDate(),
            transaction.getCreatedBy(),
            Instant.now()
        );
    }
}
