package gov.pmis.budget_ledger.ledger;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Input for {@link BudgetLedgerService#allocate(AllocateBudgetCommand)}.
 * Only project, category, amount and fiscal year are required.
 */
@Value
@Builder
public class AllocateBudgetCommand {
    UUID projectId;
    BudgetCategory category;
    BigDecimal allocatedAmount;
    Integer fiscalYear;
    Integer alertThresholdPercent;
    LocalDate startDate;
    LocalDate endDate;
    String notes;
    UUID allocatedBy;

    public static AllocateBudgetCommand of(UUID projectId, BudgetCategory category,
                                           BigDecimal allocatedAmount, int fiscalYear) {
        return AllocateBudgetCommand.builder()
            .projectId(projectId)
            .category(category)
            .allocatedAmount(allocatedAmount)
            .fiscalYear(fiscalYear)
            .build();
    }
}
