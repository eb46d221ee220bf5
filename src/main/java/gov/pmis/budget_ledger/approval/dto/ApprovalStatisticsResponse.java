package gov.pmis.budget_ledger.approval.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import gov.pmis.budget_ledger.approval.ApprovalStatistics;
import lombok.Value;

import java.math.BigDecimal;

@Value
public class ApprovalStatisticsResponse {

    @JsonProperty("total")
    long total;

    @JsonProperty("pending")
    long pending;

    @JsonProperty("approved")
    long approved;

    @JsonProperty("rejected")
    long rejected;

    @JsonProperty("cancelled")
    long cancelled;

    @JsonProperty("approval_rate_percent")
    BigDecimal approvalRatePercent;

    public static ApprovalStatisticsResponse from(ApprovalStatistics statistics) {
        return new ApprovalStatisticsResponse(
            statistics.getTotal(),
            statistics.getPending(),
            statistics.getApproved(),
            statistics.getRejected(),
            statistics.getCancelled(),
            statistics.getApprovalRatePercent()
        );
    }
}
