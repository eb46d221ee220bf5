package gov.pmis.budget_ledger.ledger.store;

import gov.pmis.budget_ledger.ledger.Amounts;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Raw sums over a line's transactions, as the store computes them.
 * Debits are EXPENSE and COMMITMENT; credits are REFUND and ADJUSTMENT.
 */
@Value
public class LedgerTotals {
    public static final LedgerTotals EMPTY = new LedgerTotals(Amounts.ZERO, Amounts.ZERO, Amounts.ZERO, 0);

    BigDecimal approvedDebits;
    BigDecimal approvedCredits;
    BigDecimal pendingDebits;
    long transactionCount;

    public static LedgerTotals of(BigDecimal approvedDebits, BigDecimal approvedCredits,
                                  BigDecimal pendingDebits, long transactionCount) {
        return new LedgerTotals(
            scaled(approvedDebits),
            scaled(approvedCredits),
            scaled(pendingDebits),
            transactionCount
        );
    }

    private static BigDecimal scaled(BigDecimal value) {
        return value == null ? Amounts.ZERO : value.setScale(Amounts.SCALE);
    }
}
