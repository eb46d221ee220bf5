package gov.pmis.budget_ledger.ledger;

/**
 * Spending category of a budget line. A project holds at most one line per
 * category and fiscal year.
 */
public enum BudgetCategory {
    PERSONNEL,
    EQUIPMENT,
    MATERIALS,
    CONTRACTORS,
    SERVICES,
    OVERHEAD,
    CONTINGENCY,
    OTHER
}
