package gov.pmis.budget_ledger.support;

import gov.pmis.budget_ledger.alert.AlertEvaluator;
import gov.pmis.budget_ledger.forecast.ForecastEngine;
import gov.pmis.budget_ledger.ledger.AllocateBudgetCommand;
import gov.pmis.budget_ledger.ledger.BudgetCategory;
import gov.pmis.budget_ledger.ledger.BudgetLedgerService;
import gov.pmis.budget_ledger.ledger.BudgetLine;
import gov.pmis.budget_ledger.observability.BudgetMetrics;
import gov.pmis.budget_ledger.outbox.OutboxService;
import gov.pmis.budget_ledger.transaction.BudgetTransaction;
import gov.pmis.budget_ledger.transaction.RecordTransactionCommand;
import gov.pmis.budget_ledger.transaction.TransactionDecision;
import gov.pmis.budget_ledger.transaction.TransactionProcessor;
import gov.pmis.budget_ledger.transaction.TransactionType;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.mockito.Mockito;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Ledger services wired against {@link InMemoryLedgerStore}, a mocked outbox and a
 * settable clock.
 */
public class LedgerFixture {

    public static final Instant NOW = Instant.parse("2026-06-15T10:00:00Z");
    public static final UUID CLERK = UUID.randomUUID();
    public static final UUID CONTROLLER = UUID.randomUUID();

    public final InMemoryLedgerStore store = new InMemoryLedgerStore();
    public final OutboxService outboxService = Mockito.mock(OutboxService.class);
    public final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
    public final BudgetMetrics metrics = new BudgetMetrics(meterRegistry);
    public final TestClock clock = new TestClock(NOW);
    public final AlertEvaluator alertEvaluator = new AlertEvaluator(store, BigDecimal.valueOf(75));
    public final BudgetLedgerService ledgerService = new BudgetLedgerService(store, outboxService, metrics, clock);
    public final TransactionProcessor processor =
        new TransactionProcessor(store, outboxService, alertEvaluator, metrics, clock);
    public final ForecastEngine forecastEngine = new ForecastEngine(store, clock);

    public BudgetLine allocate(String amount) {
        return ledgerService.allocate(UUID.randomUUID(), BudgetCategory.EQUIPMENT, new BigDecimal(amount), 2026);
    }

    public BudgetLine allocate(AllocateBudgetCommand command) {
        return ledgerService.allocate(command);
    }

    public BudgetTransaction record(UUID lineId, TransactionType type, String amount) {
        return record(lineId, type, amount, null);
    }

    public BudgetTransaction record(UUID lineId, TransactionType type, String amount, LocalDate date) {
        return processor.record(RecordTransactionCommand.builder()
            .budgetLineId(lineId)
            .type(type)
            .amount(new BigDecimal(amount))
            .description(type + " " + amount)
            .transactionDate(date)
            .createdBy(CLERK)
            .build()).getTransaction();
    }

    public BudgetTransaction recordApproved(UUID lineId, TransactionType type, String amount) {
        return recordApproved(lineId, type, amount, null);
    }

    public BudgetTransaction recordApproved(UUID lineId, TransactionType type, String amount, LocalDate date) {
        BudgetTransaction recorded = record(lineId, type, amount, date);
        return processor.decide(recorded.getId(), TransactionDecision.APPROVED, CONTROLLER, null);
    }

    public static BigDecimal amount(String value) {
        return new BigDecimal(value);
    }
}
