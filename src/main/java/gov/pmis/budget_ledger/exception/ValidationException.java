package gov.pmis.budget_ledger.exception;

import java.util.List;
import java.util.Map;

/**
 * Input failed a domain rule (non-positive amount, bad fiscal year, malformed levels...).
 */
public class ValidationException extends BudgetLedgerException {

    public static final String CODE = "VALIDATION_ERROR";

    public ValidationException(String message) {
        super(CODE, message);
    }

    public ValidationException(String message, List<String> violations) {
        super(CODE, message, Map.of("violations", List.copyOf(violations)));
    }
}
