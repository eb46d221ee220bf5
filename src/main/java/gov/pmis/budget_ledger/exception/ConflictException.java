package gov.pmis.budget_ledger.exception;

import java.util.Map;

/**
 * The request clashes with current state: duplicate allocation, closed line,
 * a transaction still gated by a pending approval.
 */
public class ConflictException extends BudgetLedgerException {

    public static final String CODE = "CONFLICT";

    public ConflictException(String message) {
        super(CODE, message);
    }

    public ConflictException(String message, Map<String, Object> details) {
        super(CODE, message, details);
    }
}
