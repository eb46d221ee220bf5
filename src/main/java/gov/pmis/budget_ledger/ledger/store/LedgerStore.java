package gov.pmis.budget_ledger.ledger.store;

import gov.pmis.budget_ledger.ledger.BudgetLine;
import gov.pmis.budget_ledger.transaction.BudgetTransaction;
import gov.pmis.budget_ledger.transaction.TransactionStatus;
import gov.pmis.budget_ledger.transaction.TransactionType;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Persistence collaborator for budget lines and their transactions.
 *
 * Implementations must serialize every read-check-write on one line through
 * {@link #inLineLock(UUID, Supplier)}: two callers holding the lock for the same
 * line never overlap, callers for different lines never wait on each other.
 */
public interface LedgerStore {

    /**
     * @throws gov.pmis.budget_ledger.exception.ConflictException when a line already
     *         exists for the same project, category and fiscal year
     */
    BudgetLine insertLine(BudgetLine line);

    Optional<BudgetLine> findLine(UUID lineId);

    /**
     * Lines matching the query, ordered by fiscal year, project and category.
     */
    List<BudgetLine> findLines(BudgetLineQuery query);

    BudgetLine updateLine(BudgetLine line);

    void deleteLine(UUID lineId);

    /**
     * Runs {@code work} while holding the exclusive lock on the line.
     *
     * @throws gov.pmis.budget_ledger.exception.NotFoundException when the line does not exist
     * @throws gov.pmis.budget_ledger.exception.LedgerContentionException when the lock
     *         cannot be acquired within the configured wait
     */
    <T> T inLineLock(UUID lineId, Supplier<T> work);

    /**
     * @param idempotencyKey optional client key, unique across all transactions
     * @throws gov.pmis.budget_ledger.exception.ConflictException when the key is already taken
     */
    BudgetTransaction insertTransaction(BudgetTransaction transaction, String idempotencyKey);

    Optional<BudgetTransaction> findTransaction(UUID transactionId);

    Optional<BudgetTransaction> findTransactionByIdempotencyKey(String idempotencyKey);

    /**
     * Transactions of a line, oldest first. Null filters match everything.
     */
    List<BudgetTransaction> findTransactions(UUID lineId, TransactionStatus status, TransactionType type);

    BudgetTransaction updateTransaction(BudgetTransaction transaction);

    LedgerTotals totals(UUID lineId);
}
