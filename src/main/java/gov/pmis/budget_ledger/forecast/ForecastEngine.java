package gov.pmis.budget_ledger.forecast;

import gov.pmis.budget_ledger.exception.NotFoundException;
import gov.pmis.budget_ledger.ledger.Amounts;
import gov.pmis.budget_ledger.ledger.BudgetLine;
import gov.pmis.budget_ledger.ledger.BudgetUtilization;
import gov.pmis.budget_ledger.ledger.store.LedgerStore;
import gov.pmis.budget_ledger.transaction.BudgetTransaction;
import gov.pmis.budget_ledger.transaction.TransactionStatus;
import gov.pmis.budget_ledger.transaction.TransactionType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.LocalDate;
import java.time.YearMonth;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.UUID;

/**
 * Projects a line's spend from its approved expense history.
 *
 * The average is taken over calendar months from the line's start month to the
 * current month, both inclusive. A line with an end date is projected at that
 * average up to its end month; otherwise the projection runs until the available
 * amount is used up, so it never exceeds the allocation.
 * Risk reflects current utilization, not the projection.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ForecastEngine {

    private static final int MONTHS_SCALE = 2;

    private final LedgerStore store;
    private final Clock clock;

    public BudgetForecast forecast(UUID lineId) {
        BudgetLine line = store.findLine(lineId)
            .orElseThrow(() -> new NotFoundException("Budget line", lineId));
        BudgetUtilization utilization = BudgetUtilization.of(line, store.totals(lineId));

        LocalDate today = LocalDate.now(clock);
        YearMonth currentMonth = YearMonth.from(today);

        List<BudgetTransaction> expenses =
            store.findTransactions(lineId, TransactionStatus.APPROVED, TransactionType.EXPENSE);

        SortedMap<String, BigDecimal> monthlySpend = new TreeMap<>();
        BigDecimal totalExpense = Amounts.ZERO;
        for (BudgetTransaction expense : expenses) {
            monthlySpend.merge(YearMonth.from(expense.getTransactionDate()).toString(), expense.getAmount(),
                BigDecimal::add);
            totalExpense = totalExpense.add(expense.getAmount());
        }

        long monthsElapsed = Math.max(1,
            ChronoUnit.MONTHS.between(YearMonth.from(line.effectiveStartDate()), currentMonth) + 1);

        BudgetForecast.BudgetForecastBuilder forecast = BudgetForecast.builder()
            .budgetLineId(lineId)
            .allocated(utilization.getAllocated())
            .spent(utilization.getSpent())
            .available(utilization.getAvailable())
            .utilizationPercent(utilization.getUtilizationPercent())
            .riskLevel(RiskLevel.forUtilization(utilization.getUtilizationPercent()))
            .monthsElapsed(monthsElapsed)
            .monthlySpend(monthlySpend);

        if (totalExpense.signum() == 0) {
            return forecast
                .averageMonthlySpend(Amounts.ZERO)
                .projectedTotal(utilization.getSpent())
                .projectedOverrun(Amounts.ZERO)
                .willExceed(false)
                .build();
        }

        BigDecimal elapsed = BigDecimal.valueOf(monthsElapsed);
        BigDecimal average = totalExpense.divide(elapsed, Amounts.SCALE, RoundingMode.HALF_UP);
        BigDecimal remainingAmount = utilization.getAvailable().max(BigDecimal.ZERO);
        // available / (total / elapsed), computed before the average is rounded
        BigDecimal monthsRemaining = remainingAmount.multiply(elapsed)
            .divide(totalExpense, MONTHS_SCALE, RoundingMode.HALF_UP);

        BigDecimal projectedSpend = remainingAmount;
        if (line.getEndDate() != null) {
            long untilEnd = Math.max(0, ChronoUnit.MONTHS.between(currentMonth, YearMonth.from(line.getEndDate())));
            projectedSpend = totalExpense.multiply(BigDecimal.valueOf(untilEnd))
                .divide(elapsed, Amounts.SCALE, RoundingMode.HALF_UP);
        }

        BigDecimal projectedTotal = utilization.getSpent()
            .add(projectedSpend)
            .setScale(Amounts.SCALE, RoundingMode.HALF_UP);
        BigDecimal overrun = projectedTotal.subtract(utilization.getAllocated()).max(Amounts.ZERO);

        LocalDate exhaustion = exhaustionDate(today, monthsRemaining);

        log.debug("Forecast for line {}: average={}, projected={}, overrun={}", lineId, average, projectedTotal, overrun);

        return forecast
            .averageMonthlySpend(average)
            .projectedTotal(projectedTotal)
            .projectedOverrun(overrun)
            .willExceed(overrun.signum() > 0)
            .monthsRemaining(monthsRemaining)
            .projectedExhaustionDate(exhaustion)
            .build();
    }

    /**
     * Today plus the remaining months rounded up, or null when that lies past the
     * last representable date.
     */
    private static LocalDate exhaustionDate(LocalDate today, BigDecimal monthsRemaining) {
        BigDecimal months = monthsRemaining.setScale(0, RoundingMode.CEILING);
        if (months.compareTo(BigDecimal.valueOf(ChronoUnit.MONTHS.between(today, LocalDate.MAX))) > 0) {
            return null;
        }
        return today.plusMonths(months.longValueExact());
    }
}
