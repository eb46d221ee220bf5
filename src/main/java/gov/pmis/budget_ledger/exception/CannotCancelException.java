package gov.pmis.budget_ledger.exception;

import java.util.Map;
import java.util.UUID;

public class CannotCancelException extends BudgetLedgerException {

    public static final String CODE = "CANNOT_CANCEL";

    public CannotCancelException(UUID requestId, String reason) {
        super(CODE,
                String.format("Approval request %s cannot be cancelled: %s", requestId, reason),
                Map.of("requestId", requestId.toString()));
    }
}
