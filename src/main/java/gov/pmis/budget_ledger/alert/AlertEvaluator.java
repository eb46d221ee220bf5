package gov.pmis.budget_ledger.alert;

import gov.pmis.budget_ledger.exception.NotFoundException;
import gov.pmis.budget_ledger.ledger.BudgetLine;
import gov.pmis.budget_ledger.ledger.BudgetUtilization;
import gov.pmis.budget_ledger.ledger.store.BudgetLineQuery;
import gov.pmis.budget_ledger.ledger.store.LedgerStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Lists ACTIVE budget lines whose utilization reached the listing threshold.
 *
 * Alerts are derived from current ledger state on each call. Nothing is stored or
 * deduplicated, so a line stays listed for as long as it stays over the threshold.
 */
@Service
@Slf4j
public class AlertEvaluator {

    private final LedgerStore store;
    private final BigDecimal listingThresholdPercent;

    public AlertEvaluator(LedgerStore store,
                          @Value("${budget.alerts.listing-threshold-percent:75}") BigDecimal listingThresholdPercent) {
        this.store = store;
        this.listingThresholdPercent = listingThresholdPercent;
    }

    /**
     * Alerts for one line, or for every active line when {@code lineId} is empty,
     * highest utilization first.
     *
     * @throws NotFoundException when the given line does not exist
     */
    public List<BudgetAlert> evaluate(Optional<UUID> lineId) {
        List<BudgetLine> lines = lineId
            .map(id -> List.of(store.findLine(id).orElseThrow(() -> new NotFoundException("Budget line", id))))
            .orElseGet(() -> store.findLines(BudgetLineQuery.ACTIVE));

        List<BudgetAlert> alerts = lines.stream()
            .filter(BudgetLine::isActive)
            .map(line -> toAlert(line, BudgetUtilization.of(line, store.totals(line.getId()))))
            .flatMap(Optional::stream)
            .sorted(Comparator.comparing(BudgetAlert::getUtilizationPercent).reversed())
            .toList();

        log.debug("Evaluated {} budget lines, {} alerts", lines.size(), alerts.size());
        return alerts;
    }

    public BigDecimal getListingThresholdPercent() {
        return listingThresholdPercent;
    }

    private Optional<BudgetAlert> toAlert(BudgetLine line, BudgetUtilization utilization) {
        BigDecimal percent = utilization.getUtilizationPercent();
        if (percent.compareTo(listingThresholdPercent) < 0) {
            return Optional.empty();
        }
        AlertSeverity severity = AlertSeverity.forUtilization(percent);
        return Optional.of(new BudgetAlert(
            line.getId(),
            line.getProjectId(),
            line.getCategory(),
            line.getFiscalYear(),
            utilization.getAllocated(),
            utilization.getSpent(),
            percent,
            line.getAlertThresholdPercent(),
            percent.compareTo(BigDecimal.valueOf(line.getAlertThresholdPercent())) >= 0,
            severity,
            severity.getMessage()
        ));
    }
}
