package gov.pmis.budget_ledger.transaction;

import gov.pmis.budget_ledger.alert.AlertEvaluator;
import gov.pmis.budget_ledger.alert.BudgetAlert;
import gov.pmis.budget_ledger.event.TransactionDecidedEvent;
import gov.pmis.budget_ledger.event.TransactionRecordedEvent;
import gov.pmis.budget_ledger.exception.ConflictException;
import gov.pmis.budget_ledger.exception.InsufficientBudgetException;
import gov.pmis.budget_ledger.exception.NotFoundException;
import gov.pmis.budget_ledger.exception.ValidationException;
import gov.pmis.budget_ledger.ledger.Amounts;
import gov.pmis.budget_ledger.ledger.BudgetLine;
import gov.pmis.budget_ledger.ledger.BudgetUtilization;
import gov.pmis.budget_ledger.ledger.store.LedgerStore;
import gov.pmis.budget_ledger.observability.BudgetMetrics;
import gov.pmis.budget_ledger.observability.CorrelationContext;
import gov.pmis.budget_ledger.outbox.OutboxService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Records transactions against budget lines and decides them.
 *
 * Both operations hold the line lock from the balance read to the write, so
 * concurrent debits on one line are checked one after another and the sum of
 * approved debits never exceeds the allocation.
 *
 * Flow:
 * 1. Validate the command
 * 2. Lock the line
 * 3. Replay an earlier transaction recorded under the same idempotency key
 * 4. Check the line is ACTIVE and, for debits, that the amount fits what is available
 * 5. Insert the PENDING transaction and its outbox event
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TransactionProcessor {

    private final LedgerStore store;
    private final OutboxService outboxService;
    private final AlertEvaluator alertEvaluator;
    private final BudgetMetrics metrics;
    private final Clock clock;

    /**
     * @throws ValidationException on a malformed command
     * @throws NotFoundException when the line does not exist
     * @throws ConflictException when the line is closed or the key belongs to another line
     * @throws InsufficientBudgetException when a debit exceeds the available amount
     */
    public RecordOutcome record(RecordTransactionCommand command) {
        validate(command);

        UUID lineId = command.getBudgetLineId();
        long started = System.nanoTime();
        MDC.put(CorrelationContext.BUDGET_LINE_ID_MDC_KEY, lineId.toString());
        try {
            RecordOutcome outcome = store.inLineLock(lineId, () -> recordLocked(command));
            metrics.recordTransaction(command.getType().name(), outcome.isReplayed() ? "replayed" : "recorded");
            return outcome;
        } catch (InsufficientBudgetException e) {
            metrics.recordInsufficientBudget(command.getType().name());
            throw e;
        } finally {
            metrics.recordLedgerLatency("record", Duration.ofNanos(System.nanoTime() - started));
            MDC.remove(CorrelationContext.BUDGET_LINE_ID_MDC_KEY);
        }
    }

    /**
     * Approves or rejects a PENDING transaction. Approving a debit folds it into spent
     * and is refused when spent would exceed the (possibly amended) allocation.
     *
     * @throws gov.pmis.budget_ledger.exception.AlreadyProcessedException when the
     *         transaction was already decided
     */
    public BudgetTransaction decide(UUID transactionId, TransactionDecision decision, UUID approverId,
                                    String comment) {
        if (decision == null) {
            throw new ValidationException("decision is required");
        }
        BudgetTransaction existing = getTransaction(transactionId);
        UUID lineId = existing.getBudgetLineId();

        long started = System.nanoTime();
        MDC.put(CorrelationContext.BUDGET_LINE_ID_MDC_KEY, lineId.toString());
        try {
            BudgetTransaction decided = store.inLineLock(lineId,
                () -> decideLocked(transactionId, decision, approverId, comment));

            metrics.recordTransactionDecision(decided.getType().name(), decided.getStatus().name());
            if (decided.getStatus() == TransactionStatus.APPROVED) {
                raiseAlerts(lineId);
            }
            return decided;
        } catch (InsufficientBudgetException e) {
            metrics.recordInsufficientBudget(existing.getType().name());
            throw e;
        } finally {
            metrics.recordLedgerLatency("decide", Duration.ofNanos(System.nanoTime() - started));
            MDC.remove(CorrelationContext.BUDGET_LINE_ID_MDC_KEY);
        }
    }

    public BudgetTransaction getTransaction(UUID transactionId) {
        return findTransaction(transactionId)
            .orElseThrow(() -> new NotFoundException(BudgetTransaction.RESOURCE, transactionId));
    }

    public Optional<BudgetTransaction> findTransaction(UUID transactionId) {
        return store.findTransaction(transactionId);
    }

    /**
     * Transactions of a line, oldest first. Null filters match everything.
     */
    public List<BudgetTransaction> listTransactions(UUID lineId, TransactionStatus status, TransactionType type) {
        if (store.findLine(lineId).isEmpty()) {
            throw new NotFoundException("Budget line", lineId);
        }
        return store.findTransactions(lineId, status, type);
    }

    private RecordOutcome recordLocked(RecordTransactionCommand command) {
        UUID lineId = command.getBudgetLineId();

        if (command.getIdempotencyKey() != null) {
            Optional<BudgetTransaction> earlier = store.findTransactionByIdempotencyKey(command.getIdempotencyKey());
            if (earlier.isPresent()) {
                BudgetTransaction replay = earlier.get();
                if (!replay.getBudgetLineId().equals(lineId)) {
                    throw new ConflictException("Idempotency key was already used on another budget line",
                        Map.of("idempotencyKey", command.getIdempotencyKey()));
                }
                log.info("Replaying transaction for idempotency key: transactionId={}", replay.getId());
                return RecordOutcome.replayed(replay);
            }
        }

        BudgetLine line = store.findLine(lineId)
            .orElseThrow(() -> new NotFoundException("Budget line", lineId));
        if (!line.isActive()) {
            throw new ConflictException("Budget line is closed: " + lineId);
        }

        if (command.getType().isDebit()) {
            BudgetUtilization utilization = BudgetUtilization.of(line, store.totals(lineId));
            if (command.getAmount().compareTo(utilization.getAvailable()) > 0) {
                log.warn("Insufficient budget: requested={}, available={}",
                    command.getAmount(), utilization.getAvailable());
                throw new InsufficientBudgetException(utilization.getAvailable(), command.getAmount());
            }
        }

        Instant now = Instant.now(clock);
        LocalDate transactionDate = command.getTransactionDate() != null
            ? command.getTransactionDate()
            : LocalDate.now(clock);

        BudgetTransaction transaction = store.insertTransaction(BudgetTransaction.record(
            lineId,
            command.getType(),
            Amounts.normalize(command.getAmount()),
            command.getDescription().trim(),
            command.getVendorId(),
            transactionDate,
            command.getCreatedBy(),
            now
        ), command.getIdempotencyKey());

        outboxService.saveEvent(TransactionRecordedEvent.fromTransaction(transaction));

        log.info("Transaction recorded: transactionId={}, type={}, amount={}",
            transaction.getId(), transaction.getType(), transaction.getAmount());

        return RecordOutcome.inserted(transaction);
    }

    private BudgetTransaction decideLocked(UUID transactionId, TransactionDecision decision, UUID approverId,
                                           String comment) {
        BudgetTransaction current = getTransaction(transactionId);
        BudgetLine line = store.findLine(current.getBudgetLineId())
            .orElseThrow(() -> new NotFoundException("Budget line", current.getBudgetLineId()));
        Instant now = Instant.now(clock);

        BudgetTransaction decided;
        if (decision == TransactionDecision.APPROVED) {
            decided = current.approve(approverId, comment, now);
            if (current.isDebit()) {
                BudgetUtilization before = BudgetUtilization.of(line, store.totals(line.getId()));
                BigDecimal headroom = before.getAllocated().subtract(before.getSpent());
                if (current.getAmount().compareTo(headroom) > 0) {
                    log.warn("Approval would overspend line: amount={}, headroom={}", current.getAmount(), headroom);
                    throw new InsufficientBudgetException(headroom, current.getAmount());
                }
            }
        } else {
            decided = current.reject(approverId, comment, now);
        }

        BudgetTransaction saved = store.updateTransaction(decided);
        BigDecimal spentAfter = BudgetUtilization.of(line, store.totals(line.getId())).getSpent();
        outboxService.saveEvent(TransactionDecidedEvent.fromTransaction(saved, spentAfter));

        log.info("Transaction decided: transactionId={}, status={}, spent={}",
            saved.getId(), saved.getStatus(), spentAfter);

        return saved;
    }

    private void raiseAlerts(UUID lineId) {
        List<BudgetAlert> alerts = alertEvaluator.evaluate(Optional.of(lineId));
        for (BudgetAlert alert : alerts) {
            log.warn("Budget alert: severity={}, utilization={}%, overThreshold={}, message={}",
                alert.getSeverity(), alert.getUtilizationPercent(), alert.isOverThreshold(), alert.getMessage());
            metrics.recordAlertsRaised(alert.getSeverity().name(), 1);
        }
    }

    private static void validate(RecordTransactionCommand command) {
        List<String> violations = new ArrayList<>();
        if (command.getBudgetLineId() == null) {
            violations.add("budgetLineId is required");
        }
        if (command.getType() == null) {
            violations.add("type is required");
        }
        if (command.getAmount() == null) {
            violations.add("amount is required");
        } else if (command.getAmount().signum() <= 0) {
            violations.add("amount must be greater than 0");
        } else if (!Amounts.hasValidScale(command.getAmount())) {
            violations.add("amount must have at most 2 decimal places");
        }
        if (command.getDescription() == null || command.getDescription().isBlank()) {
            violations.add("description is required");
        }
        if (!violations.isEmpty()) {
            throw new ValidationException("Invalid transaction", violations);
        }
    }
}
