package gov.pmis.budget_ledger.transaction;

import gov.pmis.budget_ledger.exception.AlreadyProcessedException;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * A single entry against a budget line.
 *
 * Created PENDING and decided exactly once. Decisions return new instances;
 * deciding a transaction that is no longer PENDING is rejected.
 */
@Value
public class BudgetTransaction {
    public static final String RESOURCE = "Transaction";

    UUID id;
    UUID budgetLineId;
    TransactionType type;
    BigDecimal amount;
    String description;
    UUID vendorId;
    TransactionStatus status;
    LocalDate transactionDate;
    UUID createdBy;
    UUID decidedBy;
    String decisionComment;
    Instant createdAt;
    Instant decidedAt;

    public static BudgetTransaction record(UUID budgetLineId, TransactionType type, BigDecimal amount,
                                           String description, UUID vendorId, LocalDate transactionDate,
                                           UUID createdBy, Instant now) {
        return new BudgetTransaction(
            UUID.randomUUID(),
            budgetLineId,
            type,
            amount,
            description,
            vendorId,
            TransactionStatus.PENDING,
            transactionDate,
            createdBy,
            null,
            null,
            now,
            null
        );
    }

    public BudgetTransaction approve(UUID approverId, String comment, Instant now) {
        return decide(TransactionStatus.APPROVED, approverId, comment, now);
    }

    public BudgetTransaction reject(UUID approverId, String comment, Instant now) {
        return decide(TransactionStatus.REJECTED, approverId, comment, now);
    }

    public boolean isPending() {
        return status == TransactionStatus.PENDING;
    }

    public boolean isDebit() {
        return type.isDebit();
    }

    private BudgetTransaction decide(TransactionStatus target, UUID approverId, String comment, Instant now) {
        if (status != TransactionStatus.PENDING) {
            throw new AlreadyProcessedException(RESOURCE, id, status);
        }
        return new BudgetTransaction(
            id,
            budgetLineId,
            type,
            amount,
            description,
            vendorId,
            target,
            transactionDate,
            createdBy,
            approverId,
            comment,
            createdAt,
            now
        );
    }
}
