package gov.pmis.budget_ledger.approval;

import gov.pmis.budget_ledger.exception.AlreadyProcessedException;
import gov.pmis.budget_ledger.exception.CannotCancelException;
import gov.pmis.budget_ledger.exception.UnauthorizedApproverException;
import gov.pmis.budget_ledger.exception.UnauthorizedCancelException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * State machine of a single approval request, without persistence.
 */
class ApprovalRequestTest {

    private static final Instant T0 = Instant.parse("2026-03-01T09:00:00Z");
    private static final UUID REQUESTER = UUID.randomUUID();

    private final Approver supervisor = Approver.of(UUID.randomUUID(), Set.of("supervisor"));
    private final Approver admin = Approver.of(UUID.randomUUID(), Set.of("ADMIN"));

    private ApprovalRequest twoLevelRequest() {
        return ApprovalRequest.submit(ApprovalEntityType.PROJECT, UUID.randomUUID(), REQUESTER, "Bridge repair",
            List.of(new ApprovalLevel(1, "SUPERVISOR"), new ApprovalLevel(2, "ADMIN")), T0);
    }

    @Test
    @DisplayName("Approving every level in order closes the request as APPROVED")
    void approvesLevelByLevel() {
        ApprovalRequest request = twoLevelRequest();
        assertEquals("SUPERVISOR", request.getCurrentLevel().getRequiredRole());

        ApprovalRequest afterFirst = request.approve(supervisor, "looks fine", T0.plusSeconds(60));
        assertEquals(ApprovalStatus.PENDING, afterFirst.getStatus());
        assertEquals(1, afterFirst.getCurrentLevelIndex());
        assertEquals(1, afterFirst.getDecisions().size());
        assertNull(afterFirst.getClosedAt());

        ApprovalRequest closed = afterFirst.approve(admin, null, T0.plusSeconds(120));
        assertEquals(ApprovalStatus.APPROVED, closed.getStatus());
        assertNull(closed.getCurrentLevel());
        assertEquals(T0.plusSeconds(120), closed.getClosedAt());
        assertEquals(List.of(1, 2), closed.getDecisions().stream().map(ApprovalDecision::getLevelOrder).toList());

        // the original instance is untouched
        assertEquals(0, request.getDecisions().size());
    }

    @Test
    @DisplayName("Role names match case-insensitively")
    void roleMatchIgnoresCase() {
        assertTrue(supervisor.hasRole("Supervisor"));
        assertFalse(supervisor.hasRole("ADMIN"));
        assertEquals(Set.of("FINANCE_CONTROLLER", "ADMIN"),
            Approver.fromHeaders(UUID.randomUUID(), " finance_controller , admin ,").getRoles());
        assertTrue(Approver.fromHeaders(UUID.randomUUID(), null).getRoles().isEmpty());
    }

    @Test
    @DisplayName("Deciding with the wrong role fails without changing the request")
    void wrongRoleIsRejected() {
        ApprovalRequest request = twoLevelRequest();
        UnauthorizedApproverException e = assertThrows(UnauthorizedApproverException.class,
            () -> request.approve(admin, null, T0));
        assertEquals("SUPERVISOR", e.getDetails().get("requiredRole"));
        assertThrows(UnauthorizedApproverException.class, () -> request.reject(admin, "no", T0));
    }

    @Test
    @DisplayName("Rejection closes immediately and keeps the comment as closing reason")
    void rejectCloses() {
        ApprovalRequest rejected = twoLevelRequest().reject(supervisor, "scope unclear", T0);
        assertEquals(ApprovalStatus.REJECTED, rejected.getStatus());
        assertEquals("scope unclear", rejected.getClosingReason());
        assertEquals(ApprovalVerdict.REJECTED, rejected.getDecisions().get(0).getVerdict());

        assertThrows(AlreadyProcessedException.class, () -> rejected.approve(admin, null, T0));
        assertThrows(AlreadyProcessedException.class, () -> rejected.reject(supervisor, "again", T0));
        assertThrows(CannotCancelException.class, () -> rejected.cancel(REQUESTER, "withdraw", T0));
    }

    @Test
    @DisplayName("Only the requester may cancel, and only before any decision")
    void cancelRules() {
        ApprovalRequest request = twoLevelRequest();
        assertThrows(UnauthorizedCancelException.class, () -> request.cancel(UUID.randomUUID(), "mine now", T0));

        ApprovalRequest cancelled = request.cancel(REQUESTER, "duplicate", T0);
        assertEquals(ApprovalStatus.CANCELLED, cancelled.getStatus());
        assertEquals("duplicate", cancelled.getClosingReason());

        ApprovalRequest decidedOnce = request.approve(supervisor, null, T0);
        assertThrows(CannotCancelException.class, () -> decidedOnce.cancel(REQUESTER, "too late", T0));
    }
}
