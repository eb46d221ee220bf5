package gov.pmis.budget_ledger.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import gov.pmis.budget_ledger.ledger.AmendBudgetCommand;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

import java.math.BigDecimal;

@Value
public class AmendBudgetRequest {

    @NotNull(message = "New allocated amount is required")
    @DecimalMin(value = "0.00", message = "New allocated amount must not be negative")
    @Digits(integer = 17, fraction = 2, message = "New allocated amount must have at most 2 decimal places")
    @JsonProperty("new_allocated_amount")
    BigDecimal newAllocatedAmount;

    @Min(value = 1, message = "Alert threshold must be between 1 and 100")
    @Max(value = 100, message = "Alert threshold must be between 1 and 100")
    @JsonProperty("alert_threshold_percent")
    Integer alertThresholdPercent;

    public AmendBudgetCommand toCommand() {
        return new AmendBudgetCommand(newAllocatedAmount, alertThresholdPercent);
    }
}
