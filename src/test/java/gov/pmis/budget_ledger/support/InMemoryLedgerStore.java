package gov.pmis.budget_ledger.support;

import gov.pmis.budget_ledger.exception.ConflictException;
import gov.pmis.budget_ledger.exception.NotFoundException;
import gov.pmis.budget_ledger.ledger.BudgetLine;
import gov.pmis.budget_ledger.ledger.store.BudgetLineQuery;
import gov.pmis.budget_ledger.ledger.store.LedgerStore;
import gov.pmis.budget_ledger.ledger.store.LedgerTotals;
import gov.pmis.budget_ledger.transaction.BudgetTransaction;
import gov.pmis.budget_ledger.transaction.TransactionStatus;
import gov.pmis.budget_ledger.transaction.TransactionType;

import java.math.BigDecimal;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Ledger store backed by maps, with one {@link ReentrantLock} per line standing in
 * for the row lock.
 */
public class InMemoryLedgerStore implements LedgerStore {

    private final Map<UUID, BudgetLine> lines = new ConcurrentHashMap<>();
    private final Map<UUID, StoredTransaction> transactions = new ConcurrentHashMap<>();
    private final Map<String, UUID> idempotencyKeys = new ConcurrentHashMap<>();
    private final Map<UUID, ReentrantLock> locks = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();

    @Override
    public synchronized BudgetLine insertLine(BudgetLine line) {
        boolean exists = lines.values().stream().anyMatch(existing ->
            existing.getProjectId().equals(line.getProjectId())
                && existing.getCategory() == line.getCategory()
                && existing.getFiscalYear() == line.getFiscalYear());
        if (exists) {
            throw new ConflictException("Budget line already exists");
        }
        lines.put(line.getId(), line);
        return line;
    }

    @Override
    public Optional<BudgetLine> findLine(UUID lineId) {
        return Optional.ofNullable(lines.get(lineId));
    }

    @Override
    public List<BudgetLine> findLines(BudgetLineQuery query) {
        return lines.values().stream()
            .filter(line -> query.getProjectId() == null || query.getProjectId().equals(line.getProjectId()))
            .filter(line -> query.getFiscalYear() == null || query.getFiscalYear() == line.getFiscalYear())
            .filter(line -> query.getStatus() == null || query.getStatus() == line.getStatus())
            .sorted(Comparator.comparingInt(BudgetLine::getFiscalYear)
                .thenComparing(BudgetLine::getProjectId)
                .thenComparing(BudgetLine::getCategory))
            .toList();
    }

    @Override
    public BudgetLine updateLine(BudgetLine line) {
        if (lines.replace(line.getId(), line) == null) {
            throw new NotFoundException("Budget line", line.getId());
        }
        return line;
    }

    @Override
    public void deleteLine(UUID lineId) {
        lines.remove(lineId);
    }

    @Override
    public <T> T inLineLock(UUID lineId, Supplier<T> work) {
        if (!lines.containsKey(lineId)) {
            throw new NotFoundException("Budget line", lineId);
        }
        ReentrantLock lock = locks.computeIfAbsent(lineId, id -> new ReentrantLock());
        lock.lock();
        try {
            return work.get();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public synchronized BudgetTransaction insertTransaction(BudgetTransaction transaction, String idempotencyKey) {
        if (idempotencyKey != null) {
            if (idempotencyKeys.containsKey(idempotencyKey)) {
                throw new ConflictException("Idempotency key already used");
            }
            idempotencyKeys.put(idempotencyKey, transaction.getId());
        }
        transactions.put(transaction.getId(), new StoredTransaction(transaction, sequence.incrementAndGet()));
        return transaction;
    }

    @Override
    public Optional<BudgetTransaction> findTransaction(UUID transactionId) {
        return Optional.ofNullable(transactions.get(transactionId)).map(StoredTransaction::transaction);
    }

    @Override
    public Optional<BudgetTransaction> findTransactionByIdempotencyKey(String idempotencyKey) {
        return Optional.ofNullable(idempotencyKeys.get(idempotencyKey)).flatMap(this::findTransaction);
    }

    @Override
    public List<BudgetTransaction> findTransactions(UUID lineId, TransactionStatus status, TransactionType type) {
        return transactions.values().stream()
            .sorted(Comparator.comparingLong(StoredTransaction::sequence))
            .map(StoredTransaction::transaction)
            .filter(tx -> tx.getBudgetLineId().equals(lineId))
            .filter(tx -> status == null || tx.getStatus() == status)
            .filter(tx -> type == null || tx.getType() == type)
            .toList();
    }

    @Override
    public BudgetTransaction updateTransaction(BudgetTransaction transaction) {
        transactions.computeIfPresent(transaction.getId(),
            (id, stored) -> new StoredTransaction(transaction, stored.sequence()));
        return transaction;
    }

    @Override
    public LedgerTotals totals(UUID lineId) {
        BigDecimal approvedDebits = BigDecimal.ZERO;
        BigDecimal approvedCredits = BigDecimal.ZERO;
        BigDecimal pendingDebits = BigDecimal.ZERO;
        long count = 0;
        for (StoredTransaction stored : transactions.values()) {
            BudgetTransaction tx = stored.transaction();
            if (!tx.getBudgetLineId().equals(lineId)) {
                continue;
            }
            count++;
            if (tx.getStatus() == TransactionStatus.APPROVED) {
                if (tx.isDebit()) {
                    approvedDebits = approvedDebits.add(tx.getAmount());
                } else {
                    approvedCredits = approvedCredits.add(tx.getAmount());
                }
            } else if (tx.getStatus() == TransactionStatus.PENDING && tx.isDebit()) {
                pendingDebits = pendingDebits.add(tx.getAmount());
            }
        }
        return LedgerTotals.of(approvedDebits, approvedCredits, pendingDebits, count);
    }

    public int transactionCount() {
        return transactions.size();
    }

    private record StoredTransaction(BudgetTransaction transaction, long sequence) {
    }
}
