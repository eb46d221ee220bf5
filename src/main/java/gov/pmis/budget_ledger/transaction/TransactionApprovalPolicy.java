package gov.pmis.budget_ledger.transaction;

import gov.pmis.budget_ledger.approval.ApprovalEntityType;
import gov.pmis.budget_ledger.approval.ApprovalLevel;
import gov.pmis.budget_ledger.approval.ApprovalProperties;
import gov.pmis.budget_ledger.approval.Approver;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Decides which transactions go through a TRANSACTION approval request and who
 * may decide the rest directly.
 *
 * Debits at or above the control threshold are gated by the configured transaction
 * levels; at or above the escalation threshold the escalation role is appended as a final
 * level unless the workflow already contains it.
 */
@Component
@RequiredArgsConstructor
public class TransactionApprovalPolicy {

    private final ApprovalProperties properties;

    public boolean requiresApproval(BudgetTransaction transaction) {
        return transaction.isDebit()
            && properties.getControlThreshold() != null
            && transaction.getAmount().compareTo(properties.getControlThreshold()) >= 0;
    }

    public List<ApprovalLevel> levelsFor(BudgetTransaction transaction) {
        List<ApprovalLevel> levels = new ArrayList<>(properties.workflowFor(ApprovalEntityType.TRANSACTION));

        String escalationRole = properties.getEscalationRole();
        boolean escalate = properties.getEscalationThreshold() != null
            && escalationRole != null && !escalationRole.isBlank()
            && transaction.getAmount().compareTo(properties.getEscalationThreshold()) >= 0
            && levels.stream().noneMatch(level -> level.getRequiredRole().equalsIgnoreCase(escalationRole.trim()));
        if (escalate) {
            levels.add(new ApprovalLevel(levels.size() + 1, escalationRole.trim()));
        }
        return levels;
    }

    public boolean canDecideDirectly(Approver approver) {
        return properties.getDirectDecisionRoles().stream().anyMatch(approver::hasRole);
    }

    /**
     * Role named in the error when a caller may not decide directly.
     */
    public String directDecisionRole() {
        List<String> roles = properties.getDirectDecisionRoles();
        return roles.isEmpty() ? "FINANCE_CONTROLLER" : String.join("|", roles);
    }
}
