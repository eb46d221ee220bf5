package gov.pmis.budget_ledger.transaction.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import gov.pmis.budget_ledger.transaction.BudgetTransaction;
import gov.pmis.budget_ledger.transaction.TransactionStatus;
import gov.pmis.budget_ledger.transaction.TransactionSubmission;
import gov.pmis.budget_ledger.transaction.TransactionType;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Transaction as returned by the API. {@code approval_request_id} is only present
 * on submission responses for transactions gated by an approval request.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TransactionResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("budget_line_id")
    UUID budgetLineId;

    @JsonProperty("type")
    TransactionType type;

    @JsonProperty("amount")
    BigDecimal amount;

    @JsonProperty("description")
    String description;

    @JsonProperty("vendor_id")
    UUID vendorId;

    @JsonProperty("status")
    TransactionStatus status;

    @JsonProperty("transaction_date")
    LocalDate transactionDate;

    @JsonProperty("created_by")
    UUID createdBy;

    @JsonProperty("decided_by")
    UUID decidedBy;

    @JsonProperty("decision_comment")
    String decisionComment;

    @JsonProperty("approval_request_id")
    UUID approvalRequestId;

    @JsonProperty("created_at")
    Instant createdAt;

    @JsonProperty("decided_at")
    Instant decidedAt;

    public static TransactionResponse from(BudgetTransaction transaction) {
        return builderFrom(transaction).build();
    }

    public static TransactionResponse from(TransactionSubmission submission) {
        return builderFrom(submission.getTransaction())
            .approvalRequestId(submission.getApprovalRequestId())
            .build();
    }

    private static TransactionResponseBuilder builderFrom(BudgetTransaction transaction) {
        return TransactionResponse.builder()
            .id(transaction.getId())
            .budgetLineId(transaction.getBudgetLineId())
            .type(transaction.getType())
            .amount(transaction.getAmount())
            .description(transaction.getDescription())
            .vendorId(transaction.getVendorId())
            .status(transaction.getStatus())
            .transactionDate(transaction.getTransactionDate())
            .createdBy(transaction.getCreatedBy())
            .decidedBy(transaction.getDecidedBy())
            .decisionComment(transaction.getDecisionComment())
            .createdAt(transaction.getCreatedAt())
            .decidedAt(transaction.getDecidedAt());
    }
}
