package gov.pmis.budget_ledger.ledger;

import lombok.Value;

import java.math.BigDecimal;

/**
 * Typed amendment of a budget line. A null threshold leaves the current one in place.
 */
@Value
public class AmendBudgetCommand {
    BigDecimal newAllocatedAmount;
    Integer alertThresholdPercent;

    public static AmendBudgetCommand of(BigDecimal newAllocatedAmount) {
        return new AmendBudgetCommand(newAllocatedAmount, null);
    }
}
