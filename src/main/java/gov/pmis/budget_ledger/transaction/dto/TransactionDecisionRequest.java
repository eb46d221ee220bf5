package gov.pmis.budget_ledger.transaction.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import gov.pmis.budget_ledger.transaction.TransactionDecision;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

@Value
public class TransactionDecisionRequest {

    @NotNull(message = "Decision is required")
    @JsonProperty("decision")
    TransactionDecision decision;

    @JsonProperty("comment")
    String comment;
}
