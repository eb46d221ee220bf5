package gov.pmis.budget_ledger.approval.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

/**
 * Body of approve, reject and cancel calls. Reject requires a comment; cancel
 * reads {@code reason}.
 */
@Value
public class ApprovalActionRequest {

    @JsonProperty("comment")
    String comment;

    @JsonProperty("reason")
    String reason;
}
