package gov.pmis.budget_ledger.exception;

import java.util.UUID;

/**
 * The per-line lock could not be acquired within the configured wait after all retries.
 * Clients may retry the request.
 */
public class LedgerContentionException extends BudgetLedgerException {

    public static final String CODE = "LEDGER_CONTENTION";

    public LedgerContentionException(UUID lockedId, int attempts, Throwable cause) {
        super(CODE,
                String.format("Could not lock %s after %d attempt(s)", lockedId, attempts),
                cause);
    }
}
