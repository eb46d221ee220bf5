package gov.pmis.budget_ledger.exception;

import java.util.Map;
import java.util.UUID;

/**
 * A decision was attempted on something that has already been decided.
 * Raised for both terminal approval requests and non-pending transactions.
 */
public class AlreadyProcessedException extends BudgetLedgerException {

    public static final String CODE = "ALREADY_PROCESSED";

    public AlreadyProcessedException(String resource, UUID id, Enum<?> status) {
        super(CODE,
                String.format("%s %s has already been processed (status %s)", resource, id, status),
                Map.of("resource", resource, "id", id.toString(), "status", status.name()));
    }
}
