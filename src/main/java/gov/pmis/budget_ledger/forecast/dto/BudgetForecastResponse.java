package gov.pmis.budget_ledger.forecast.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import gov.pmis.budget_ledger.forecast.BudgetForecast;
import gov.pmis.budget_ledger.forecast.RiskLevel;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.SortedMap;
import java.util.UUID;

@Value
@Builder
public class BudgetForecastResponse {

    @JsonProperty("budget_line_id")
    UUID budgetLineId;

    @JsonProperty("allocated_amount")
    BigDecimal allocatedAmount;

    @JsonProperty("spent_amount")
    BigDecimal spentAmount;

    @JsonProperty("available_amount")
    BigDecimal availableAmount;

    @JsonProperty("utilization_percent")
    BigDecimal utilizationPercent;

    @JsonProperty("average_monthly_spend")
    BigDecimal averageMonthlySpend;

    @JsonProperty("projected_total")
    BigDecimal projectedTotal;

    @JsonProperty("projected_overrun")
    BigDecimal projectedOverrun;

    @JsonProperty("will_exceed")
    boolean willExceed;

    @JsonProperty("risk_level")
    RiskLevel riskLevel;

    @JsonProperty("months_elapsed")
    long monthsElapsed;

    @JsonProperty("months_remaining")
    BigDecimal monthsRemaining;

    @JsonProperty("projected_exhaustion_date")
    LocalDate projectedExhaustionDate;

    @JsonProperty("monthly_spend")
    SortedMap<String, BigDecimal> monthlySpend;

    public static BudgetForecastResponse from(BudgetForecast forecast) {
        return BudgetForecastResponse.builder()
            .budgetLineId(forecast.getBudgetLineId())
            .allocatedAmount(forecast.getAllocated())
            .spentAmount(forecast.getSpent())
            .availableAmount(forecast.getAvailable())
            .utilizationPercent(forecast.getUtilizationPercent())
            .averageMonthlySpend(forecast.getAverageMonthlySpend())
            .projectedTotal(forecast.getProjectedTotal())
            .projectedOverrun(forecast.getProjectedOverrun())
            .willExceed(forecast.isWillExceed())
            .riskLevel(forecast.getRiskLevel())
            .monthsElapsed(forecast.getMonthsElapsed())
            .monthsRemaining(forecast.getMonthsRemaining())
            .projectedExhaustionDate(forecast.getProjectedExhaustionDate())
            .monthlySpend(forecast.getMonthlySpend())
            .build();
    }
}
