package gov.pmis.budget_ledger.alert.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import gov.pmis.budget_ledger.alert.AlertSeverity;
import gov.pmis.budget_ledger.alert.BudgetAlert;
import gov.pmis.budget_ledger.ledger.BudgetCategory;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

@Value
public class BudgetAlertResponse {

    @JsonProperty("budget_line_id")
    UUID budgetLineId;

    @JsonProperty("project_id")
    UUID projectId;

    @JsonProperty("category")
    BudgetCategory category;

    @JsonProperty("fiscal_year")
    int fiscalYear;

    @JsonProperty("allocated_amount")
    BigDecimal allocatedAmount;

    @JsonProperty("spent_amount")
    BigDecimal spentAmount;

    @JsonProperty("utilization_percent")
    BigDecimal utilizationPercent;

    @JsonProperty("alert_threshold_percent")
    int alertThresholdPercent;

    @JsonProperty("over_threshold")
    boolean overThreshold;

    @JsonProperty("severity")
    AlertSeverity severity;

    @JsonProperty("message")
    String message;

    public static BudgetAlertResponse from(BudgetAlert alert) {
        return new BudgetAlertResponse(
            alert.getBudgetLineId(),
            alert.getProjectId(),
            alert.getCategory(),
            alert.getFiscalYear(),
            alert.getAllocated(),
            alert.getSpent(),
            alert.getUtilizationPercent(),
            alert.getAlertThresholdPercent(),
            alert.isOverThreshold(),
            alert.getSeverity(),
            alert.getMessage()
        );
    }
}
