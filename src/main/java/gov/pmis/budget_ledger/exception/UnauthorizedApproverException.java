package gov.pmis.budget_ledger.exception;

import java.util.Map;
import java.util.UUID;

/**
 * The caller does not hold the role needed to decide: the current level's role for an
 * approval request, or a direct-decision role for a transaction.
 */
public class UnauthorizedApproverException extends BudgetLedgerException {

    public static final String CODE = "UNAUTHORIZED_APPROVER";

    public UnauthorizedApproverException(UUID subjectId, String requiredRole) {
        super(CODE,
                String.format("Deciding %s requires role %s", subjectId, requiredRole),
                Map.of("id", subjectId.toString(), "requiredRole", requiredRole));
    }
}
