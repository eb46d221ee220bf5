package gov.pmis.budget_ledger.exception;

import java.util.Map;
import java.util.UUID;

public class UnauthorizedCancelException extends BudgetLedgerException {

    public static final String CODE = "UNAUTHORIZED_CANCEL";

    public UnauthorizedCancelException(UUID requestId) {
        super(CODE,
                String.format("Only the requester can cancel approval request %s", requestId),
                Map.of("requestId", requestId.toString()));
    }
}
