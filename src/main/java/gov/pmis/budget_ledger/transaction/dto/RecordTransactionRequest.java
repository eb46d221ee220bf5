package gov.pmis.budget_ledger.transaction.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import gov.pmis.budget_ledger.transaction.RecordTransactionCommand;
import gov.pmis.budget_ledger.transaction.TransactionType;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

@Value
public class RecordTransactionRequest {

    @NotNull(message = "Transaction type is required")
    @JsonProperty("type")
    TransactionType type;

    @NotNull(message = "Amount is required")
    @DecimalMin(value = "0.01", message = "Amount must be greater than 0")
    @Digits(integer = 17, fraction = 2, message = "Amount must have at most 2 decimal places")
    @JsonProperty("amount")
    BigDecimal amount;

    @NotBlank(message = "Description is required")
    @JsonProperty("description")
    String description;

    @JsonProperty("vendor_id")
    UUID vendorId;

    @JsonProperty("transaction_date")
    LocalDate transactionDate;

    public RecordTransactionCommand toCommand(UUID budgetLineId, UUID createdBy, String idempotencyKey) {
        return RecordTransactionCommand.builder()
            .budgetLineId(budgetLineId)
            .type(type)
            .amount(amount)
            .description(description)
            .vendorId(vendorId)
            .transactionDate(transactionDate)
            .createdBy(createdBy)
            .idempotencyKey(idempotencyKey)
            .build();
    }
}
