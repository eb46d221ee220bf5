package gov.pmis.budget_ledger.exception;

import java.math.BigDecimal;
import java.util.Map;

/**
 * A debit would push a budget line past its allocation.
 */
public class InsufficientBudgetException extends BudgetLedgerException {

    public static final String CODE = "INSUFFICIENT_BUDGET";

    private final BigDecimal available;
    private final BigDecimal requested;

    public InsufficientBudgetException(BigDecimal available, BigDecimal requested) {
        super(CODE,
                String.format("Insufficient budget: available=%s, requested=%s", available, requested),
                Map.of("available", available, "requested", requested));
        this.available = available;
        this.requested = requested;
    }

    public BigDecimal getAvailable() {
        return available;
    }

    public BigDecimal getRequested() {
        return requested;
    }
}
