package gov.pmis.budget_ledger.ledger;

import gov.pmis.budget_ledger.event.BudgetAllocatedEvent;
import gov.pmis.budget_ledger.exception.ConflictException;
import gov.pmis.budget_ledger.exception.NotFoundException;
import gov.pmis.budget_ledger.exception.ValidationException;
import gov.pmis.budget_ledger.ledger.store.BudgetLineQuery;
import gov.pmis.budget_ledger.ledger.store.LedgerStore;
import gov.pmis.budget_ledger.ledger.store.LedgerTotals;
import gov.pmis.budget_ledger.observability.BudgetMetrics;
import gov.pmis.budget_ledger.observability.CorrelationContext;
import gov.pmis.budget_ledger.outbox.OutboxService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Allocation, amendment and closure of budget lines.
 *
 * Utilization is recomputed from the line's transactions on every call. Amendments
 * and removals run under the line lock so they cannot interleave with a transaction
 * being recorded or decided on the same line.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BudgetLedgerService {

    static final int MIN_FISCAL_YEAR = 1000;
    static final int MAX_FISCAL_YEAR = 9999;

    private final LedgerStore store;
    private final OutboxService outboxService;
    private final BudgetMetrics metrics;
    private final Clock clock;

    @Transactional
    public BudgetLine allocate(UUID projectId, BudgetCategory category, BigDecimal amount, int fiscalYear) {
        return allocate(AllocateBudgetCommand.of(projectId, category, amount, fiscalYear));
    }

    /**
     * Creates a line for a (project, category, fiscal year) that has none yet.
     *
     * @throws ValidationException when a field is missing or out of range
     * @throws ConflictException when the line already exists
     */
    @Transactional
    public BudgetLine allocate(AllocateBudgetCommand command) {
        List<String> violations = new ArrayList<>();
        if (command.getProjectId() == null) {
            violations.add("projectId is required");
        }
        if (command.getCategory() == null) {
            violations.add("category is required");
        }
        checkAmount(command.getAllocatedAmount(), "allocatedAmount", false, violations);
        if (command.getFiscalYear() == null
                || command.getFiscalYear() < MIN_FISCAL_YEAR || command.getFiscalYear() > MAX_FISCAL_YEAR) {
            violations.add("fiscalYear must be a four-digit year");
        }
        checkThreshold(command.getAlertThresholdPercent(), violations);
        if (command.getStartDate() != null && command.getEndDate() != null
                && command.getEndDate().isBefore(command.getStartDate())) {
            violations.add("endDate must not precede startDate");
        }
        if (!violations.isEmpty()) {
            throw new ValidationException("Invalid budget allocation", violations);
        }

        BudgetLine line = store.insertLine(BudgetLine.allocate(command, now()));
        outboxService.saveEvent(BudgetAllocatedEvent.fromLine(line));
        metrics.recordAllocation(line.getCategory().name());

        log.info("Budget allocated: lineId={}, projectId={}, category={}, fiscalYear={}, amount={}",
            line.getId(), line.getProjectId(), line.getCategory(), line.getFiscalYear(), line.getAllocatedAmount());

        return line;
    }

    public BudgetLine getLine(UUID lineId) {
        return store.findLine(lineId)
            .orElseThrow(() -> new NotFoundException("Budget line", lineId));
    }

    public BudgetUtilization getUtilization(UUID lineId) {
        BudgetLine line = getLine(lineId);
        return BudgetUtilization.of(line, store.totals(lineId));
    }

    public List<BudgetLine> listLines(UUID projectId, Integer fiscalYear, BudgetLineStatus status) {
        return store.findLines(BudgetLineQuery.builder()
            .projectId(projectId)
            .fiscalYear(fiscalYear)
            .status(status)
            .build());
    }

    /**
     * Changes the allocation (and optionally the alert threshold) of an active line.
     *
     * @throws ValidationException when the new amount is negative or below approved spend
     * @throws ConflictException when the line is closed
     */
    public BudgetLine amend(UUID lineId, AmendBudgetCommand command) {
        List<String> violations = new ArrayList<>();
        checkAmount(command.getNewAllocatedAmount(), "newAllocatedAmount", true, violations);
        checkThreshold(command.getAlertThresholdPercent(), violations);
        if (!violations.isEmpty()) {
            throw new ValidationException("Invalid budget amendment", violations);
        }

        return withLineContext(lineId, () -> store.inLineLock(lineId, () -> {
            BudgetLine line = getLine(lineId);
            if (!line.isActive()) {
                throw new ConflictException("Budget line is closed: " + lineId);
            }

            BudgetUtilization utilization = BudgetUtilization.of(line, store.totals(lineId));
            if (command.getNewAllocatedAmount().compareTo(utilization.getSpent()) < 0) {
                throw new ValidationException(String.format(
                    "New allocation %s is below approved spend %s",
                    command.getNewAllocatedAmount(), utilization.getSpent()));
            }

            BudgetLine amended = store.updateLine(
                line.amend(command.getNewAllocatedAmount(), command.getAlertThresholdPercent(), now()));

            log.info("Budget amended: allocated {} -> {}, threshold={}%",
                line.getAllocatedAmount(), amended.getAllocatedAmount(), amended.getAlertThresholdPercent());
            return amended;
        }));
    }

    /**
     * Deletes a line that never carried a transaction; soft-closes any other line.
     */
    public RemovalOutcome remove(UUID lineId) {
        return withLineContext(lineId, () -> store.inLineLock(lineId, () -> {
            BudgetLine line = getLine(lineId);
            LedgerTotals totals = store.totals(lineId);

            if (totals.getTransactionCount() == 0) {
                store.deleteLine(lineId);
                log.info("Budget line deleted");
                return RemovalOutcome.DELETED;
            }

            if (line.isActive()) {
                store.updateLine(line.close(now()));
            }
            log.info("Budget line closed instead of deleted: transactions={}", totals.getTransactionCount());
            return RemovalOutcome.CLOSED;
        }));
    }

    public BudgetLine close(UUID lineId) {
        return withLineContext(lineId, () -> store.inLineLock(lineId, () -> {
            BudgetLine line = getLine(lineId);
            if (!line.isActive()) {
                return line;
            }
            BudgetLine closed = store.updateLine(line.close(now()));
            log.info("Budget line closed");
            return closed;
        }));
    }

    private static void checkAmount(BigDecimal amount, String field, boolean zeroAllowed, List<String> violations) {
        if (amount == null) {
            violations.add(field + " is required");
        } else if (zeroAllowed ? amount.signum() < 0 : amount.signum() <= 0) {
            violations.add(field + (zeroAllowed ? " must not be negative" : " must be greater than 0"));
        } else if (!Amounts.hasValidScale(amount)) {
            violations.add(field + " must have at most 2 decimal places");
        }
    }

    private static void checkThreshold(Integer threshold, List<String> violations) {
        if (threshold != null && (threshold < 1 || threshold > 100)) {
            violations.add("alertThresholdPercent must be between 1 and 100");
        }
    }

    private <T> T withLineContext(UUID lineId, Supplier<T> work) {
        MDC.put(CorrelationContext.BUDGET_LINE_ID_MDC_KEY, lineId.toString());
        try {
            return work.get();
        } finally {
            MDC.remove(CorrelationContext.BUDGET_LINE_ID_MDC_KEY);
        }
    }

    private Instant now() {
        return Instant.now(clock);
    }
}
