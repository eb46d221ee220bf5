package gov.pmis.budget_ledger.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import gov.pmis.budget_ledger.ledger.AllocateBudgetCommand;
import gov.pmis.budget_ledger.ledger.BudgetCategory;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

@Value
public class AllocateBudgetRequest {

    @NotNull(message = "Project ID is required")
    @JsonProperty("project_id")
    UUID projectId;

    @NotNull(message = "Category is required")
    @JsonProperty("category")
    BudgetCategory category;

    @NotNull(message = "Allocated amount is required")
    @DecimalMin(value = "0.01", message = "Allocated amount must be greater than 0")
    @Digits(integer = 17, fraction = 2, message = "Allocated amount must have at most 2 decimal places")
    @JsonProperty("allocated_amount")
    BigDecimal allocatedAmount;

    @NotNull(message = "Fiscal year is required")
    @Min(value = 1000, message = "Fiscal year must be a four-digit year")
    @Max(value = 9999, message = "Fiscal year must be a four-digit year")
    @JsonProperty("fiscal_year")
    Integer fiscalYear;

    @Min(value = 1, message = "Alert threshold must be between 1 and 100")
    @Max(value = 100, message = "Alert threshold must be between 1 and 100")
    @JsonProperty("alert_threshold_percent")
    Integer alertThresholdPercent;

    @JsonProperty("start_date")
    LocalDate startDate;

    @JsonProperty("end_date")
    LocalDate endDate;

    @JsonProperty("notes")
    String notes;

    public AllocateBudgetCommand toCommand(UUID allocatedBy) {
        return AllocateBudgetCommand.builder()
            .projectId(projectId)
            .category(category)
            .allocatedAmount(allocatedAmount)
            .fiscalYear(fiscalYear)
            .alertThresholdPercent(alertThresholdPercent)
            .startDate(startDate)
            .endDate(endDate)
            .notes(notes)
            .allocatedBy(allocatedBy)
            .build();
    }
}
