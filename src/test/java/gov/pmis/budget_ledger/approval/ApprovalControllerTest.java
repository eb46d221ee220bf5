package gov.pmis.budget_ledger.approval;

import gov.pmis.budget_ledger.config.JacksonConfig;
import gov.pmis.budget_ledger.exception.AlreadyProcessedException;
import gov.pmis.budget_ledger.exception.CannotCancelException;
import gov.pmis.budget_ledger.exception.NotFoundException;
import gov.pmis.budget_ledger.exception.UnauthorizedApproverException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(ApprovalController.class)
@Import(JacksonConfig.class)
class ApprovalControllerTest {

    private static final Instant NOW = Instant.parse("2026-03-01T09:00:00Z");
    private static final UUID REQUESTER = UUID.randomUUID();

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private ApprovalWorkflowService workflowService;

    private static ApprovalRequest pendingRequest() {
        return ApprovalRequest.submit(ApprovalEntityType.PURCHASE_ORDER, UUID.randomUUID(), REQUESTER, "Steel",
            List.of(new ApprovalLevel(1, "FINANCE_CONTROLLER"), new ApprovalLevel(2, "SUPERVISOR")), NOW);
    }

    @Test
    @DisplayName("POST /api/approvals submits with the caller as requester")
    void submit() throws Exception {
        ApprovalRequest request = pendingRequest();
        when(workflowService.submit(any(SubmitApprovalCommand.class))).thenReturn(request);

        mockMvc.perform(post("/api/approvals")
                .contentType(MediaType.APPLICATION_JSON)
                .header("X-User-Id", REQUESTER)
                .content("{\"entity_type\": \"PURCHASE_ORDER\", \"entity_id\": \"" + request.getEntityId() + "\", "
                    + "\"title\": \"Steel\", \"levels\": [{\"order\": 2, \"required_role\": \"SUPERVISOR\"}, "
                    + "{\"order\": 1, \"required_role\": \"FINANCE_CONTROLLER\"}]}"))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.status").value("PENDING"))
            .andExpect(jsonPath("$.current_level").value(1))
            .andExpect(jsonPath("$.current_role").value("FINANCE_CONTROLLER"))
            .andExpect(jsonPath("$.levels.length()").value(2));

        ArgumentCaptor<SubmitApprovalCommand> captor = ArgumentCaptor.forClass(SubmitApprovalCommand.class);
        verify(workflowService).submit(captor.capture());
        assertEquals(REQUESTER, captor.getValue().getRequesterId());
        assertEquals(2, captor.getValue().getLevels().size());
    }

    @Test
    @DisplayName("Submitting without X-User-Id is a 400")
    void submitNeedsUser() throws Exception {
        mockMvc.perform(post("/api/approvals")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"entity_type\": \"PROJECT\", \"entity_id\": \"" + UUID.randomUUID() + "\"}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("Missing Required Header"));
    }

    @Test
    @DisplayName("Approve builds the approver from the gateway headers")
    void approve() throws Exception {
        ApprovalRequest request = pendingRequest();
        UUID approverId = UUID.randomUUID();
        ApprovalRequest advanced = request.approve(Approver.of(approverId, Set.of("FINANCE_CONTROLLER")), null, NOW);
        when(workflowService.approve(eq(request.getId()), any(Approver.class), isNull())).thenReturn(advanced);

        mockMvc.perform(post("/api/approvals/{id}/approve", request.getId())
                .header("X-User-Id", approverId)
                .header("X-User-Roles", "FINANCE_CONTROLLER"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.current_level").value(2))
            .andExpect(jsonPath("$.decisions[0].approver_id").value(approverId.toString()))
            .andExpect(jsonPath("$.decisions[0].decision").value("APPROVED"));

        ArgumentCaptor<Approver> captor = ArgumentCaptor.forClass(Approver.class);
        verify(workflowService).approve(eq(request.getId()), captor.capture(), isNull());
        assertTrue(captor.getValue().hasRole("FINANCE_CONTROLLER"));
    }

    @Test
    @DisplayName("Out-of-order approval is 403")
    void approveOutOfOrder() throws Exception {
        UUID id = UUID.randomUUID();
        when(workflowService.approve(eq(id), any(Approver.class), any()))
            .thenThrow(new UnauthorizedApproverException(id, "FINANCE_CONTROLLER"));

        mockMvc.perform(post("/api/approvals/{id}/approve", id)
                .header("X-User-Id", UUID.randomUUID())
                .header("X-User-Roles", "SUPERVISOR"))
            .andExpect(status().isForbidden())
            .andExpect(jsonPath("$.details.requiredRole").value("FINANCE_CONTROLLER"));
    }

    @Test
    @DisplayName("Deciding a closed request is 409")
    void rejectClosed() throws Exception {
        UUID id = UUID.randomUUID();
        when(workflowService.reject(eq(id), any(Approver.class), eq("late")))
            .thenThrow(new AlreadyProcessedException(ApprovalRequest.RESOURCE, id, ApprovalStatus.REJECTED));

        mockMvc.perform(post("/api/approvals/{id}/reject", id)
                .contentType(MediaType.APPLICATION_JSON)
                .header("X-User-Id", UUID.randomUUID())
                .header("X-User-Roles", "SUPERVISOR")
                .content("{\"comment\": \"late\"}"))
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.code").value("ALREADY_PROCESSED"));
    }

    @Test
    @DisplayName("Cancel after a decision is 409")
    void cancelAfterDecision() throws Exception {
        UUID id = UUID.randomUUID();
        when(workflowService.cancel(id, REQUESTER, "dup"))
            .thenThrow(new CannotCancelException(id, "a decision has already been recorded"));

        mockMvc.perform(post("/api/approvals/{id}/cancel", id)
                .contentType(MediaType.APPLICATION_JSON)
                .header("X-User-Id", REQUESTER)
                .content("{\"reason\": \"dup\"}"))
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.code").value("CANNOT_CANCEL"));
    }

    @Test
    @DisplayName("Literal paths are not swallowed by /{id}")
    void literalRoutes() throws Exception {
        Map<ApprovalStatus, Long> counts = new EnumMap<>(ApprovalStatus.class);
        counts.put(ApprovalStatus.APPROVED, 3L);
        counts.put(ApprovalStatus.REJECTED, 1L);
        when(workflowService.statistics()).thenReturn(ApprovalStatistics.from(counts));
        when(workflowService.findPendingFor(any(Approver.class))).thenReturn(List.of(pendingRequest()));

        mockMvc.perform(get("/api/approvals/statistics"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.total").value(4))
            .andExpect(jsonPath("$.approval_rate_percent").value(75.0));

        mockMvc.perform(get("/api/approvals/pending/me")
                .header("X-User-Id", UUID.randomUUID())
                .header("X-User-Roles", "FINANCE_CONTROLLER"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.length()").value(1));
    }

    @Test
    @DisplayName("Unknown workflow and unknown request are 404")
    void notFound() throws Exception {
        UUID id = UUID.randomUUID();
        when(workflowService.getWorkflow(ApprovalEntityType.BUDGET))
            .thenThrow(new NotFoundException("Approval workflow", ApprovalEntityType.BUDGET));
        when(workflowService.getHistory(id)).thenThrow(new NotFoundException(ApprovalRequest.RESOURCE, id));

        mockMvc.perform(get("/api/approvals/workflows/{type}", "BUDGET"))
            .andExpect(status().isNotFound());
        mockMvc.perform(get("/api/approvals/{id}/history", id))
            .andExpect(status().isNotFound());
    }
}
