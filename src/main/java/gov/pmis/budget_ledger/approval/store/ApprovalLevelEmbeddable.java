package gov.pmis.budget_ledger.approval.store;

import gov.pmis.budget_ledger.approval.ApprovalLevel;
import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

@Embeddable
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class ApprovalLevelEmbeddable {

    @Column(name = "level_order", nullable = false)
    private int levelOrder;

    @Column(name = "required_role", nullable = false, length = 64)
    private String requiredRole;

    static ApprovalLevelEmbeddable fromDomain(ApprovalLevel level) {
        ApprovalLevelEmbeddable embeddable = new ApprovalLevelEmbeddable();
        embeddable.levelOrder = level.getOrder();
        embeddable.requiredRole = level.getRequiredRole();
        return embeddable;
    }

    ApprovalLevel toDomain() {
        return new ApprovalLevel(levelOrder, requiredRole);
    }
}
