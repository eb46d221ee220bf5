package gov.pmis.budget_ledger.approval;

import gov.pmis.budget_ledger.approval.dto.ApprovalActionRequest;
import gov.pmis.budget_ledger.approval.dto.ApprovalDecisionResponse;
import gov.pmis.budget_ledger.approval.dto.ApprovalLevelDto;
import gov.pmis.budget_ledger.approval.dto.ApprovalRequestResponse;
import gov.pmis.budget_ledger.approval.dto.ApprovalStatisticsResponse;
import gov.pmis.budget_ledger.approval.dto.SubmitApprovalRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

/**
 * REST endpoints for approval requests.
 */
@RestController
@RequestMapping("/api/approvals")
@RequiredArgsConstructor
public class ApprovalController {

    private static final String USER_ID_HEADER = "X-User-Id";
    private static final String USER_ROLES_HEADER = "X-User-Roles";

    private final ApprovalWorkflowService workflowService;

    @PostMapping
    public ResponseEntity<ApprovalRequestResponse> submit(
            @Valid @RequestBody SubmitApprovalRequest request,
            @RequestHeader(USER_ID_HEADER) UUID userId) {

        ApprovalRequest submitted = workflowService.submit(request.toCommand(userId));
        return ResponseEntity.status(HttpStatus.CREATED).body(ApprovalRequestResponse.from(submitted));
    }

    @GetMapping("/pending/me")
    public List<ApprovalRequestResponse> pendingForMe(
            @RequestHeader(USER_ID_HEADER) UUID userId,
            @RequestHeader(value = USER_ROLES_HEADER, required = false) String roles) {

        return workflowService.findPendingFor(Approver.fromHeaders(userId, roles)).stream()
            .map(ApprovalRequestResponse::from)
            .toList();
    }

    @GetMapping("/workflows/{entityType}")
    public List<ApprovalLevelDto> workflow(@PathVariable("entityType") ApprovalEntityType entityType) {
        return workflowService.getWorkflow(entityType).stream()
            .map(ApprovalLevelDto::from)
            .toList();
    }

    @GetMapping("/statistics")
    public ApprovalStatisticsResponse statistics() {
        return ApprovalStatisticsResponse.from(workflowService.statistics());
    }

    @GetMapping("/{id}")
    public ApprovalRequestResponse get(@PathVariable("id") UUID id) {
        return ApprovalRequestResponse.from(workflowService.getRequest(id));
    }

    @GetMapping("/{id}/history")
    public List<ApprovalDecisionResponse> history(@PathVariable("id") UUID id) {
        return workflowService.getHistory(id).stream()
            .map(ApprovalDecisionResponse::from)
            .toList();
    }

    @PostMapping("/{id}/approve")
    public ApprovalRequestResponse approve(
            @PathVariable("id") UUID id,
            @RequestBody(required = false) ApprovalActionRequest request,
            @RequestHeader(USER_ID_HEADER) UUID userId,
            @RequestHeader(value = USER_ROLES_HEADER, required = false) String roles) {

        String comment = request == null ? null : request.getComment();
        return ApprovalRequestResponse.from(
            workflowService.approve(id, Approver.fromHeaders(userId, roles), comment));
    }

    @PostMapping("/{id}/reject")
    public ApprovalRequestResponse reject(
            @PathVariable("id") UUID id,
            @RequestBody(required = false) ApprovalActionRequest request,
            @RequestHeader(USER_ID_HEADER) UUID userId,
            @RequestHeader(value = USER_ROLES_HEADER, required = false) String roles) {

        String comment = request == null ? null : request.getComment();
        return ApprovalRequestResponse.from(
            workflowService.reject(id, Approver.fromHeaders(userId, roles), comment));
    }

    @PostMapping("/{id}/cancel")
    public ApprovalRequestResponse cancel(
            @PathVariable("id") UUID id,
            @RequestBody(required = false) ApprovalActionRequest request,
            @RequestHeader(USER_ID_HEADER) UUID userId) {

        String reason = request == null ? null : request.getReason();
        return ApprovalRequestResponse.from(workflowService.cancel(id, userId, reason));
    }
}
