package gov.pmis.budget_ledger.ledger;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.UUID;

/**
 * An allocation of funds to one project, category and fiscal year.
 *
 * Spent, committed and available amounts are never stored here; they are derived
 * from the line's transactions on every read (see {@link BudgetUtilization}).
 * State changes return new instances.
 */
@Value
public class BudgetLine {
    public static final int DEFAULT_ALERT_THRESHOLD_PERCENT = 90;

    UUID id;
    UUID projectId;
    BudgetCategory category;
    int fiscalYear;
    BigDecimal allocatedAmount;
    int alertThresholdPercent;
    BudgetLineStatus status;
    LocalDate startDate;
    LocalDate endDate;
    String notes;
    UUID allocatedBy;
    Instant createdAt;
    Instant updatedAt;

    /**
     * Creates a new ACTIVE line from a validated command.
     */
    public static BudgetLine allocate(AllocateBudgetCommand command, Instant now) {
        return new BudgetLine(
            UUID.randomUUID(),
            command.getProjectId(),
            command.getCategory(),
            command.getFiscalYear(),
            Amounts.normalize(command.getAllocatedAmount()),
            command.getAlertThresholdPercent() != null
                ? command.getAlertThresholdPercent()
                : DEFAULT_ALERT_THRESHOLD_PERCENT,
            BudgetLineStatus.ACTIVE,
            command.getStartDate(),
            command.getEndDate(),
            command.getNotes(),
            command.getAllocatedBy(),
            now,
            now
        );
    }

    /**
     * Returns a copy with a new allocation and, when given, a new alert threshold.
     * The caller has already checked the amount against approved spend.
     */
    public BudgetLine amend(BigDecimal newAllocatedAmount, Integer newAlertThresholdPercent, Instant now) {
        return new BudgetLine(
            id,
            projectId,
            category,
            fiscalYear,
            Amounts.normalize(newAllocatedAmount),
            newAlertThresholdPercent != null ? newAlertThresholdPercent : alertThresholdPercent,
            status,
            startDate,
            endDate,
            notes,
            allocatedBy,
            createdAt,
            now
        );
    }

    public BudgetLine close(Instant now) {
        return new BudgetLine(
            id,
            projectId,
            category,
            fiscalYear,
            allocatedAmount,
            alertThresholdPercent,
            BudgetLineStatus.CLOSED,
            startDate,
            endDate,
            notes,
            allocatedBy,
            createdAt,
            now
        );
    }

    public boolean isActive() {
        return status == BudgetLineStatus.ACTIVE;
    }

    /**
     * Start of the spending period: the explicit start date, else the creation date (UTC).
     */
    public LocalDate effectiveStartDate() {
        if (startDate != null) {
            return startDate;
        }
        return LocalDate.ofInstant(createdAt, ZoneOffset.UTC);
    }
}
