package gov.pmis.budget_ledger.approval;

import gov.pmis.budget_ledger.ledger.Amounts;
import lombok.Value;

import java.math.BigDecimal;
import java.util.Map;

/**
 * Request counts per status. The approval rate is approved over decided
 * (approved + rejected), in percent.
 */
@Value
public class ApprovalStatistics {
    long total;
    long pending;
    long approved;
    long rejected;
    long cancelled;
    BigDecimal approvalRatePercent;

    public static ApprovalStatistics from(Map<ApprovalStatus, Long> counts) {
        long pending = counts.getOrDefault(ApprovalStatus.PENDING, 0L);
        long approved = counts.getOrDefault(ApprovalStatus.APPROVED, 0L);
        long rejected = counts.getOrDefault(ApprovalStatus.REJECTED, 0L);
        long cancelled = counts.getOrDefault(ApprovalStatus.CANCELLED, 0L);

        return new ApprovalStatistics(
            pending + approved + rejected + cancelled,
            pending,
            approved,
            rejected,
            cancelled,
            Amounts.percentOf(BigDecimal.valueOf(approved), BigDecimal.valueOf(approved + rejected))
        );
    }
}
