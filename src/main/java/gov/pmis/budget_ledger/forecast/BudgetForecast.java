package gov.pmis.budget_ledger.forecast;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.SortedMap;
import java.util.UUID;

/**
 * Spend projection for one budget line.
 *
 * {@code monthsRemaining} and {@code projectedExhaustionDate} are null while the
 * line has no approved expenses; the exhaustion date is also null when it would fall
 * past {@link java.time.LocalDate#MAX}. {@code monthlySpend} is keyed by {@code yyyy-MM}.
 */
@Value
@Builder
public class BudgetForecast {
    UUID budgetLineId;
    BigDecimal allocated;
    BigDecimal spent;
    BigDecimal available;
    BigDecimal utilizationPercent;
    BigDecimal averageMonthlySpend;
    BigDecimal projectedTotal;
    BigDecimal projectedOverrun;
    boolean willExceed;
    RiskLevel riskLevel;
    long monthsElapsed;
    BigDecimal monthsRemaining;
    LocalDate projectedExhaustionDate;
    SortedMap<String, BigDecimal> monthlySpend;
}
