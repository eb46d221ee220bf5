package gov.pmis.budget_ledger.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import gov.pmis.budget_ledger.ledger.RemovalOutcome;
import lombok.Value;

import java.util.UUID;

@Value
public class RemovalResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("outcome")
    RemovalOutcome outcome;
}
