package gov.pmis.budget_ledger.exception;

import java.util.Map;

public class NotFoundException extends BudgetLedgerException {

    public static final String CODE = "NOT_FOUND";

    /**
     * @param resource human-readable resource name, e.g. "Budget line"
     * @param key id or natural key that was looked up
     */
    public NotFoundException(String resource, Object key) {
        super(CODE, String.format("%s not found: %s", resource, key),
                Map.of("resource", resource, "id", String.valueOf(key)));
    }
}
