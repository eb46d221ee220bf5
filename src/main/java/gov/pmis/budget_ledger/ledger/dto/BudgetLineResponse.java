package gov.pmis.budget_ledger.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import gov.pmis.budget_ledger.ledger.BudgetCategory;
import gov.pmis.budget_ledger.ledger.BudgetLine;
import gov.pmis.budget_ledger.ledger.BudgetLineStatus;
import gov.pmis.budget_ledger.ledger.BudgetUtilization;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * A budget line with its utilization as of the request.
 */
@Value
@Builder
public class BudgetLineResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("project_id")
    UUID projectId;

    @JsonProperty("category")
    BudgetCategory category;

    @JsonProperty("fiscal_year")
    int fiscalYear;

    @JsonProperty("status")
    BudgetLineStatus status;

    @JsonProperty("allocated_amount")
    BigDecimal allocatedAmount;

    @JsonProperty("spent_amount")
    BigDecimal spentAmount;

    @JsonProperty("committed_amount")
    BigDecimal committedAmount;

    @JsonProperty("available_amount")
    BigDecimal availableAmount;

    @JsonProperty("utilization_percent")
    BigDecimal utilizationPercent;

    @JsonProperty("commitment_percent")
    BigDecimal commitmentPercent;

    @JsonProperty("alert_threshold_percent")
    int alertThresholdPercent;

    @JsonProperty("start_date")
    LocalDate startDate;

    @JsonProperty("end_date")
    LocalDate endDate;

    @JsonProperty("notes")
    String notes;

    @JsonProperty("allocated_by")
    UUID allocatedBy;

    @JsonProperty("created_at")
    Instant createdAt;

    @JsonProperty("updated_at")
    Instant updatedAt;

    public static BudgetLineResponse from(BudgetLine line, BudgetUtilization utilization) {
        return BudgetLineResponse.builder()
            .id(line.getId())
            .projectId(line.getProjectId())
            .category(line.getCategory())
            .fiscalYear(line.getFiscalYear())
            .status(line.getStatus())
            .allocatedAmount(utilization.getAllocated())
            .spentAmount(utilization.getSpent())
            .committedAmount(utilization.getCommitted())
            .availableAmount(utilization.getAvailable())
            .utilizationPercent(utilization.getUtilizationPercent())
            .commitmentPercent(utilization.getCommitmentPercent())
            .alertThresholdPercent(line.getAlertThresholdPercent())
            .startDate(line.getStartDate())
            .endDate(line.getEndDate())
            .notes(line.getNotes())
            .allocatedBy(line.getAllocatedBy())
            .createdAt(line.getCreatedAt())
            .updatedAt(line.getUpdatedAt())
            .build();
    }
}
