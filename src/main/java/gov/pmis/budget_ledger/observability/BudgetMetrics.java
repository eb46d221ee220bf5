package gov.pmis.budget_ledger.observability;

import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Counters and timers for ledger and approval operations.
 *
 * Tag values are enum names or fixed outcome strings, so cardinality stays bounded.
 */
@Component
public class BudgetMetrics {

    private final MeterRegistry registry;

    public BudgetMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordAllocation(String category) {
        registry.counter("budget.allocations", "category", category).increment();
    }

    /**
     * @param outcome {@code recorded}, {@code replayed} or the failure code
     */
    public void recordTransaction(String type, String outcome) {
        registry.counter("budget.transactions.recorded", "type", type, "outcome", outcome).increment();
    }

    public void recordTransactionDecision(String type, String status) {
        registry.counter("budget.transactions.decided", "type", type, "status", status).increment();
    }

    public void recordInsufficientBudget(String type) {
        registry.counter("budget.transactions.insufficient", "type", type).increment();
    }

    public void recordLedgerLatency(String operation, Duration duration) {
        registry.timer("budget.ledger.latency", "operation", operation).record(duration);
    }

    public void recordApprovalSubmitted(String entityType) {
        registry.counter("approval.requests.submitted", "entity_type", entityType).increment();
    }

    public void recordApprovalClosed(String entityType, String status) {
        registry.counter("approval.requests.closed", "entity_type", entityType, "status", status).increment();
    }

    public void recordAlertsRaised(String severity, int count) {
        registry.counter("budget.alerts.raised", "severity", severity).increment(count);
    }

    public void recordIdempotencyHit() {
        registry.counter("idempotency.cache", "result", "hit").increment();
    }

    public void recordIdempotencyMiss() {
        registry.counter("idempotency.cache", "result", "miss").increment();
    }
}
