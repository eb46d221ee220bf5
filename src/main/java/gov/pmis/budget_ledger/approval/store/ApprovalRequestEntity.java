package gov.pmis.budget_ledger.approval.store;

import gov.pmis.budget_ledger.approval.ApprovalEntityType;
import gov.pmis.budget_ledger.approval.ApprovalRequest;
import gov.pmis.budget_ledger.approval.ApprovalStatus;
import jakarta.persistence.CollectionTable;
import jakarta.persistence.Column;
import jakarta.persistence.ElementCollection;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.OrderColumn;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * JPA mapping of an approval request. Levels are written once; decisions are append-only.
 */
@Entity
@Table(name = "approval_requests")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class ApprovalRequestEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Enumerated(EnumType.STRING)
    @Column(name = "entity_type", nullable = false, updatable = false, length = 32)
    private ApprovalEntityType entityType;

    @Column(name = "entity_id", nullable = false, updatable = false)
    private UUID entityId;

    @Column(name = "requester_id", nullable = false, updatable = false)
    private UUID requesterId;

    @Column(name = "title", updatable = false)
    private String title;

    @ElementCollection
    @CollectionTable(name = "approval_request_levels", joinColumns = @JoinColumn(name = "approval_request_id"))
    @OrderColumn(name = "level_index")
    private List<ApprovalLevelEmbeddable> levels = new ArrayList<>();

    @Column(name = "current_level_index", nullable = false)
    private int currentLevelIndex;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private ApprovalStatus status;

    @ElementCollection
    @CollectionTable(name = "approval_decisions", joinColumns = @JoinColumn(name = "approval_request_id"))
    @OrderColumn(name = "decision_index")
    private List<ApprovalDecisionEmbeddable> decisions = new ArrayList<>();

    @Column(name = "closing_reason", columnDefinition = "TEXT")
    private String closingReason;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Column(name = "closed_at")
    private Instant closedAt;

    static ApprovalRequestEntity fromDomain(ApprovalRequest request) {
        ApprovalRequestEntity entity = new ApprovalRequestEntity();
        entity.id = request.getId();
        entity.entityType = request.getEntityType();
        entity.entityId = request.getEntityId();
        entity.requesterId = request.getRequesterId();
        entity.title = request.getTitle();
        request.getLevels().forEach(level -> entity.levels.add(ApprovalLevelEmbeddable.fromDomain(level)));
        entity.createdAt = request.getCreatedAt();
        entity.updateFromDomain(request);
        return entity;
    }

    /**
     * Copies the mutable state. Decisions already stored are left untouched; only
     * the tail the domain object added is appended.
     */
    void updateFromDomain(ApprovalRequest request) {
        this.currentLevelIndex = request.getCurrentLevelIndex();
        this.status = request.getStatus();
        this.closingReason = request.getClosingReason();
        this.updatedAt = request.getUpdatedAt();
        this.closedAt = request.getClosedAt();
        for (int i = decisions.size(); i < request.getDecisions().size(); i++) {
            decisions.add(ApprovalDecisionEmbeddable.fromDomain(request.getDecisions().get(i)));
        }
    }

    public ApprovalRequest toDomain() {
        return new ApprovalRequest(
            id,
            entityType,
            entityId,
            requesterId,
            title,
            levels.stream().map(ApprovalLevelEmbeddable::toDomain).toList(),
            currentLevelIndex,
            status,
            decisions.stream().map(ApprovalDecisionEmbeddable::toDomain).toList(),
            closingReason,
            createdAt,
            updatedAt,
            closedAt
        );
    }
}
