package gov.pmis.budget_ledger.ledger.store;

import gov.pmis.budget_ledger.ledger.BudgetLineStatus;
import lombok.Builder;
import lombok.Value;

import java.util.UUID;

/**
 * Optional filters for listing budget lines. Null fields do not filter.
 */
@Value
@Builder
public class BudgetLineQuery {
    public static final BudgetLineQuery ACTIVE = BudgetLineQuery.builder().status(BudgetLineStatus.ACTIVE).build();

    UUID projectId;
    Integer fiscalYear;
    BudgetLineStatus status;
}
