package gov.pmis.budget_ledger.approval;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Approval settings bound from {@code budget.approval.*}.
 *
 * <pre>
 * budget:
 *   approval:
 *     control-threshold: 50000.00
 *     transaction-levels: FINANCE_CONTROLLER,SUPERVISOR
 *     escalation-threshold: 200000.00
 *     escalation-role: ADMIN
 *     direct-decision-roles: FINANCE_CONTROLLER,ADMIN
 *     workflows:
 *       PROJECT: SUPERVISOR,ADMIN
 * </pre>
 */
@Data
@Component
@ConfigurationProperties(prefix = "budget.approval")
public class ApprovalProperties {

    /**
     * Debits at or above this amount are routed through a TRANSACTION approval.
     */
    private BigDecimal controlThreshold = new BigDecimal("50000.00");

    /**
     * Roles, in level order, of the workflow gating large debits.
     */
    private List<String> transactionLevels = new ArrayList<>(List.of("FINANCE_CONTROLLER", "SUPERVISOR"));

    /**
     * Debits at or above this amount get an extra final level held by {@link #escalationRole}.
     */
    private BigDecimal escalationThreshold = new BigDecimal("200000.00");

    private String escalationRole = "ADMIN";

    /**
     * Roles allowed to decide a transaction that no approval request gates.
     */
    private List<String> directDecisionRoles = new ArrayList<>(List.of("FINANCE_CONTROLLER", "ADMIN"));

    /**
     * Default workflow per entity type, used when a submission names no levels.
     */
    private Map<ApprovalEntityType, List<String>> workflows = new EnumMap<>(ApprovalEntityType.class);

    /**
     * Levels of the default workflow for {@code entityType}, empty when none is configured.
     * TRANSACTION falls back to {@link #transactionLevels}.
     */
    public List<ApprovalLevel> workflowFor(ApprovalEntityType entityType) {
        List<String> roles = workflows.get(entityType);
        if ((roles == null || roles.isEmpty()) && entityType == ApprovalEntityType.TRANSACTION) {
            roles = transactionLevels;
        }
        return toLevels(roles);
    }

    static List<ApprovalLevel> toLevels(List<String> roles) {
        List<ApprovalLevel> levels = new ArrayList<>();
        if (roles == null) {
            return levels;
        }
        for (String role : roles) {
            if (role != null && !role.isBlank()) {
                levels.add(new ApprovalLevel(levels.size() + 1, role.trim()));
            }
        }
        return levels;
    }
}
