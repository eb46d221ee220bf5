package gov.pmis.budget_ledger.ledger;

import gov.pmis.budget_ledger.alert.AlertEvaluator;
import gov.pmis.budget_ledger.alert.dto.BudgetAlertResponse;
import gov.pmis.budget_ledger.approval.Approver;
import gov.pmis.budget_ledger.forecast.ForecastEngine;
import gov.pmis.budget_ledger.forecast.dto.BudgetForecastResponse;
import gov.pmis.budget_ledger.ledger.dto.AllocateBudgetRequest;
import gov.pmis.budget_ledger.ledger.dto.AmendBudgetRequest;
import gov.pmis.budget_ledger.ledger.dto.BudgetLineResponse;
import gov.pmis.budget_ledger.ledger.dto.RemovalResponse;
import gov.pmis.budget_ledger.transaction.BudgetTransaction;
import gov.pmis.budget_ledger.transaction.TransactionProcessor;
import gov.pmis.budget_ledger.transaction.TransactionStatus;
import gov.pmis.budget_ledger.transaction.TransactionSubmission;
import gov.pmis.budget_ledger.transaction.TransactionSubmissionService;
import gov.pmis.budget_ledger.transaction.TransactionType;
import gov.pmis.budget_ledger.transaction.dto.RecordTransactionRequest;
import gov.pmis.budget_ledger.transaction.dto.TransactionDecisionRequest;
import gov.pmis.budget_ledger.transaction.dto.TransactionResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * REST endpoints for budget lines, their transactions, alerts and forecasts.
 *
 * Caller identity comes from the gateway's {@code X-User-Id} and {@code X-User-Roles}
 * headers. Recording a transaction requires an {@code Idempotency-Key}; a repeated
 * key returns the original transaction with 200 instead of 201.
 */
@RestController
@RequestMapping("/api/budgets")
@RequiredArgsConstructor
@Slf4j
public class BudgetController {

    static final String IDEMPOTENCY_KEY_HEADER = "Idempotency-Key";
    static final String USER_ID_HEADER = "X-User-Id";
    static final String USER_ROLES_HEADER = "X-User-Roles";

    private final BudgetLedgerService ledgerService;
    private final TransactionProcessor transactionProcessor;
    private final TransactionSubmissionService submissionService;
    private final AlertEvaluator alertEvaluator;
    private final ForecastEngine forecastEngine;

    @PostMapping
    public ResponseEntity<BudgetLineResponse> allocate(
            @Valid @RequestBody AllocateBudgetRequest request,
            @RequestHeader(value = USER_ID_HEADER, required = false) UUID userId) {

        BudgetLine line = ledgerService.allocate(request.toCommand(userId));
        return ResponseEntity.status(HttpStatus.CREATED)
            .body(BudgetLineResponse.from(line, ledgerService.getUtilization(line.getId())));
    }

    @GetMapping
    public List<BudgetLineResponse> list(
            @RequestParam(value = "project_id", required = false) UUID projectId,
            @RequestParam(value = "fiscal_year", required = false) Integer fiscalYear,
            @RequestParam(value = "status", required = false) BudgetLineStatus status) {

        return ledgerService.listLines(projectId, fiscalYear, status).stream()
            .map(line -> BudgetLineResponse.from(line, ledgerService.getUtilization(line.getId())))
            .toList();
    }

    @GetMapping("/alerts")
    public List<BudgetAlertResponse> alerts(@RequestParam(value = "line_id", required = false) UUID lineId) {
        return alertEvaluator.evaluate(Optional.ofNullable(lineId)).stream()
            .map(BudgetAlertResponse::from)
            .toList();
    }

    @GetMapping("/{id}")
    public BudgetLineResponse get(@PathVariable("id") UUID id) {
        return BudgetLineResponse.from(ledgerService.getLine(id), ledgerService.getUtilization(id));
    }

    @PutMapping("/{id}")
    public BudgetLineResponse amend(@PathVariable("id") UUID id, @Valid @RequestBody AmendBudgetRequest request) {
        BudgetLine line = ledgerService.amend(id, request.toCommand());
        return BudgetLineResponse.from(line, ledgerService.getUtilization(id));
    }

    /**
     * Deletes a line without transactions; closes it otherwise.
     */
    @DeleteMapping("/{id}")
    public RemovalResponse remove(@PathVariable("id") UUID id) {
        return new RemovalResponse(id, ledgerService.remove(id));
    }

    @GetMapping("/{id}/forecast")
    public BudgetForecastResponse forecast(@PathVariable("id") UUID id) {
        return BudgetForecastResponse.from(forecastEngine.forecast(id));
    }

    @GetMapping("/{id}/transactions")
    public List<TransactionResponse> transactions(
            @PathVariable("id") UUID id,
            @RequestParam(value = "status", required = false) TransactionStatus status,
            @RequestParam(value = "type", required = false) TransactionType type) {

        return transactionProcessor.listTransactions(id, status, type).stream()
            .map(TransactionResponse::from)
            .toList();
    }

    @PostMapping("/{id}/transactions")
    public ResponseEntity<TransactionResponse> recordTransaction(
            @PathVariable("id") UUID id,
            @Valid @RequestBody RecordTransactionRequest request,
            @RequestHeader(IDEMPOTENCY_KEY_HEADER) String idempotencyKey,
            @RequestHeader(USER_ID_HEADER) UUID userId) {

        log.info("Received transaction: lineId={}, type={}, amount={}, idempotencyKey={}",
            id, request.getType(), request.getAmount(), idempotencyKey);

        TransactionSubmission submission = submissionService.submit(request.toCommand(id, userId, idempotencyKey));
        HttpStatus status = submission.isReplayed() ? HttpStatus.OK : HttpStatus.CREATED;
        return ResponseEntity.status(status).body(TransactionResponse.from(submission));
    }

    @PostMapping("/transactions/{transactionId}/decision")
    public TransactionResponse decideTransaction(
            @PathVariable("transactionId") UUID transactionId,
            @Valid @RequestBody TransactionDecisionRequest request,
            @RequestHeader(USER_ID_HEADER) UUID userId,
            @RequestHeader(value = USER_ROLES_HEADER, required = false) String roles) {

        BudgetTransaction decided = submissionService.decide(
            transactionId, request.getDecision(), Approver.fromHeaders(userId, roles), request.getComment());
        return TransactionResponse.from(decided);
    }
}
