package gov.pmis.budget_ledger.alert;

import gov.pmis.budget_ledger.ledger.BudgetCategory;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * A budget line whose utilization crossed the listing threshold.
 * {@code overThreshold} compares against the line's own alert threshold.
 */
@Value
public class BudgetAlert {
    UUID budgetLineId;
    UUID projectId;
    BudgetCategory category;
    int fiscalYear;
    BigDecimal allocated;
    BigDecimal spent;
    BigDecimal utilizationPercent;
    int alertThresholdPercent;
    boolean overThreshold;
    AlertSeverity severity;
    String message;
}
