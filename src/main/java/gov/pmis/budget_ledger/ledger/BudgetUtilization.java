package gov.pmis.budget_ledger.ledger;

import gov.pmis.budget_ledger.ledger.store.LedgerTotals;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Derived amounts for a budget line at a point in time.
 *
 * <ul>
 *   <li>spent = max(0, approved EXPENSE/COMMITMENT − approved REFUND/ADJUSTMENT)</li>
 *   <li>committed = pending EXPENSE/COMMITMENT</li>
 *   <li>available = allocated − spent − committed</li>
 * </ul>
 *
 * Percentages are zero when nothing is allocated.
 */
@Value
public class BudgetUtilization {
    UUID budgetLineId;
    BigDecimal allocated;
    BigDecimal spent;
    BigDecimal committed;
    BigDecimal available;
    BigDecimal utilizationPercent;
    BigDecimal commitmentPercent;

    public static BudgetUtilization of(BudgetLine line, LedgerTotals totals) {
        BigDecimal allocated = line.getAllocatedAmount();
        BigDecimal spent = totals.getApprovedDebits().subtract(totals.getApprovedCredits()).max(Amounts.ZERO);
        BigDecimal committed = totals.getPendingDebits();
        BigDecimal available = allocated.subtract(spent).subtract(committed);

        return new BudgetUtilization(
            line.getId(),
            allocated,
            spent,
            committed,
            available,
            Amounts.percentOf(spent, allocated),
            Amounts.percentOf(spent.add(committed), allocated)
        );
    }
}
