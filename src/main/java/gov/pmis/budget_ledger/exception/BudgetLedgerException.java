package gov.pmis.budget_ledger.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Base type for every domain failure raised by the ledger and the approval workflow.
 *
 * Each subclass carries a stable machine-readable code. The HTTP layer maps the
 * code to a status; the core never knows about HTTP.
 */
public abstract class BudgetLedgerException extends RuntimeException {

    private final String code;
    private final Map<String, Object> details;

    protected BudgetLedgerException(String code, String message) {
        this(code, message, Map.of());
    }

    protected BudgetLedgerException(String code, String message, Map<String, Object> details) {
        super(message);
        this.code = code;
        this.details = Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }

    protected BudgetLedgerException(String code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
        this.details = Map.of();
    }

    public String getCode() {
        return code;
    }

    public Map<String, Object> getDetails() {
        return details;
    }
}
