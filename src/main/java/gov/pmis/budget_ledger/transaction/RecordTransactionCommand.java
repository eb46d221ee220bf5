package gov.pmis.budget_ledger.transaction;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Input for {@link TransactionProcessor#record(RecordTransactionCommand)}.
 * {@code transactionDate} defaults to today; {@code idempotencyKey} is optional.
 */
@Value
@Builder
public class RecordTransactionCommand {
    UUID budgetLineId;
    TransactionType type;
    BigDecimal amount;
    String description;
    UUID vendorId;
    LocalDate transactionDate;
    UUID createdBy;
    String idempotencyKey;
}
