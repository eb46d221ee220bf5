package gov.pmis.budget_ledger.forecast;

import gov.pmis.budget_ledger.exception.NotFoundException;
import gov.pmis.budget_ledger.ledger.AllocateBudgetCommand;
import gov.pmis.budget_ledger.ledger.BudgetCategory;
import gov.pmis.budget_ledger.ledger.BudgetLine;
import gov.pmis.budget_ledger.support.LedgerFixture;
import gov.pmis.budget_ledger.transaction.TransactionType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

import static gov.pmis.budget_ledger.support.LedgerFixture.amount;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Forecasts at a fixed clock of 2026-06-15.
 */
class ForecastEngineTest {

    private final LedgerFixture fixture = new LedgerFixture();

    private BudgetLine allocate(String amount, LocalDate start, LocalDate end) {
        return fixture.allocate(AllocateBudgetCommand.builder()
            .projectId(UUID.randomUUID())
            .category(BudgetCategory.MATERIALS)
            .allocatedAmount(amount(amount))
            .fiscalYear(2026)
            .startDate(start)
            .endDate(end)
            .build());
    }

    @Test
    @DisplayName("No history: zero average and no overrun")
    void emptyHistory() {
        BudgetLine line = fixture.allocate("12000.00");

        BudgetForecast forecast = fixture.forecastEngine.forecast(line.getId());

        assertEquals(amount("0.00"), forecast.getAverageMonthlySpend());
        assertEquals(amount("0.00"), forecast.getProjectedTotal());
        assertEquals(amount("0.00"), forecast.getProjectedOverrun());
        assertFalse(forecast.isWillExceed());
        assertEquals(RiskLevel.LOW, forecast.getRiskLevel());
        assertEquals(1, forecast.getMonthsElapsed());
        assertNull(forecast.getMonthsRemaining());
        assertNull(forecast.getProjectedExhaustionDate());
        assertTrue(forecast.getMonthlySpend().isEmpty());
    }

    @Test
    @DisplayName("Approved commitments count as spent but not towards the expense average")
    void commitmentsDoNotFeedAverage() {
        BudgetLine line = fixture.allocate("12000.00");
        fixture.recordApproved(line.getId(), TransactionType.COMMITMENT, "5000.00");

        BudgetForecast forecast = fixture.forecastEngine.forecast(line.getId());

        assertEquals(amount("0.00"), forecast.getAverageMonthlySpend());
        assertEquals(amount("5000.00"), forecast.getSpent());
        assertEquals(amount("5000.00"), forecast.getProjectedTotal());
        assertFalse(forecast.isWillExceed());
    }

    @Test
    @DisplayName("Average over elapsed months, projected to the end month")
    void projectsToEndDate() {
        BudgetLine line = allocate("12000.00", LocalDate.of(2026, 1, 1), LocalDate.of(2026, 12, 31));
        fixture.recordApproved(line.getId(), TransactionType.EXPENSE, "1500.00", LocalDate.of(2026, 2, 10));
        fixture.recordApproved(line.getId(), TransactionType.EXPENSE, "1500.00", LocalDate.of(2026, 4, 10));
        fixture.recordApproved(line.getId(), TransactionType.EXPENSE, "3000.00", LocalDate.of(2026, 6, 1));
        // pending entries are not history
        fixture.record(line.getId(), TransactionType.EXPENSE, "100.00", LocalDate.of(2026, 6, 2));

        BudgetForecast forecast = fixture.forecastEngine.forecast(line.getId());

        assertEquals(6, forecast.getMonthsElapsed());
        assertEquals(amount("1000.00"), forecast.getAverageMonthlySpend());
        assertEquals(amount("12000.00"), forecast.getProjectedTotal());
        assertEquals(amount("0.00"), forecast.getProjectedOverrun());
        assertFalse(forecast.isWillExceed());
        assertEquals(amount("50.00"), forecast.getUtilizationPercent());
        assertEquals(RiskLevel.MEDIUM, forecast.getRiskLevel());
        assertEquals(amount("5.90"), forecast.getMonthsRemaining());
        assertEquals(LocalDate.of(2026, 12, 15), forecast.getProjectedExhaustionDate());
        assertEquals(List.of("2026-02", "2026-04", "2026-06"), List.copyOf(forecast.getMonthlySpend().keySet()));
        assertEquals(amount("3000.00"), forecast.getMonthlySpend().get("2026-06"));
    }

    @Test
    @DisplayName("Spend rate that outruns the allocation before the end month")
    void detectsOverrun() {
        BudgetLine line = allocate("10000.00", LocalDate.of(2026, 5, 1), LocalDate.of(2026, 9, 30));
        fixture.recordApproved(line.getId(), TransactionType.EXPENSE, "4000.00", LocalDate.of(2026, 5, 20));
        fixture.recordApproved(line.getId(), TransactionType.EXPENSE, "4000.00", LocalDate.of(2026, 6, 5));

        BudgetForecast forecast = fixture.forecastEngine.forecast(line.getId());

        assertEquals(2, forecast.getMonthsElapsed());
        assertEquals(amount("4000.00"), forecast.getAverageMonthlySpend());
        assertEquals(amount("20000.00"), forecast.getProjectedTotal());
        assertEquals(amount("10000.00"), forecast.getProjectedOverrun());
        assertTrue(forecast.isWillExceed());
        assertEquals(RiskLevel.HIGH, forecast.getRiskLevel());
        assertEquals(amount("0.50"), forecast.getMonthsRemaining());
        assertEquals(LocalDate.of(2026, 7, 15), forecast.getProjectedExhaustionDate());
    }

    @Test
    @DisplayName("Without an end date the projection runs until the available amount is used")
    void projectsUntilExhaustion() {
        BudgetLine line = allocate("10000.00", LocalDate.of(2026, 5, 1), null);
        fixture.recordApproved(line.getId(), TransactionType.EXPENSE, "4000.00", LocalDate.of(2026, 5, 20));
        fixture.recordApproved(line.getId(), TransactionType.EXPENSE, "4000.00", LocalDate.of(2026, 6, 5));

        BudgetForecast forecast = fixture.forecastEngine.forecast(line.getId());

        assertEquals(amount("10000.00"), forecast.getProjectedTotal());
        assertFalse(forecast.isWillExceed());
    }

    @Test
    @DisplayName("Open-ended projection with fractional months left stays within the allocation")
    void fractionalMonthsDoNotInflateProjection() {
        BudgetLine line = allocate("10000.00", LocalDate.of(2026, 6, 1), null);
        fixture.recordApproved(line.getId(), TransactionType.EXPENSE, "6000.00", LocalDate.of(2026, 6, 3));

        BudgetForecast forecast = fixture.forecastEngine.forecast(line.getId());

        assertEquals(amount("6000.00"), forecast.getAverageMonthlySpend());
        assertEquals(amount("0.67"), forecast.getMonthsRemaining());
        assertEquals(amount("10000.00"), forecast.getProjectedTotal());
        assertEquals(amount("0.00"), forecast.getProjectedOverrun());
        assertFalse(forecast.isWillExceed());
        assertEquals(LocalDate.of(2026, 7, 15), forecast.getProjectedExhaustionDate());
    }

    @Test
    @DisplayName("Spend too small to show in the average still yields months remaining")
    void averageRoundingToZero() {
        BudgetLine line = allocate("12000.00", LocalDate.of(2026, 1, 1), null);
        fixture.recordApproved(line.getId(), TransactionType.EXPENSE, "0.01", LocalDate.of(2026, 1, 5));

        BudgetForecast forecast = assertDoesNotThrow(() -> fixture.forecastEngine.forecast(line.getId()));

        assertEquals(6, forecast.getMonthsElapsed());
        assertEquals(amount("0.00"), forecast.getAverageMonthlySpend());
        assertEquals(amount("7199994.00"), forecast.getMonthsRemaining());
        assertEquals(amount("12000.00"), forecast.getProjectedTotal());
        assertFalse(forecast.isWillExceed());
        assertEquals(LocalDate.of(602025, 12, 15), forecast.getProjectedExhaustionDate());
    }

    @Test
    @DisplayName("Exhaustion beyond the last representable date is left empty")
    void exhaustionPastCalendarRange() {
        BudgetLine line = allocate("200000000.00", null, null);
        fixture.recordApproved(line.getId(), TransactionType.EXPENSE, "0.01", LocalDate.of(2026, 6, 10));

        BudgetForecast forecast = assertDoesNotThrow(() -> fixture.forecastEngine.forecast(line.getId()));

        assertEquals(1, forecast.getMonthsElapsed());
        assertEquals(amount("19999999999.00"), forecast.getMonthsRemaining());
        assertNull(forecast.getProjectedExhaustionDate());
        assertFalse(forecast.isWillExceed());
    }

    @Test
    @DisplayName("Unknown line")
    void unknownLine() {
        assertThrows(NotFoundException.class, () -> fixture.forecastEngine.forecast(UUID.randomUUID()));
    }
}
