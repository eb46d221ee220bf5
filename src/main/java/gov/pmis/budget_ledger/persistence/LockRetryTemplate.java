package gov.pmis.budget_ledger.persistence;

import gov.pmis.budget_ledger.exception.LedgerContentionException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionCallback;
import org.springframework.transaction.support.TransactionSynchronizationManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.UUID;

/**
 * Runs a unit of work that takes a row lock, with a bounded lock wait.
 *
 * The lock wait is set per transaction with {@code SET LOCAL lock_timeout}, so it is
 * released with the transaction. When the template owns the transaction, a failed lock
 * acquisition is retried a bounded number of times with a short linear backoff. When an
 * outer transaction is already active the failure cannot be retried here (PostgreSQL has
 * aborted the outer transaction), so it surfaces immediately.
 */
@Component
@Slf4j
public class LockRetryTemplate {

    private static final long BACKOFF_STEP_MS = 25;

    private final TransactionTemplate transactionTemplate;
    private final JdbcTemplate jdbcTemplate;
    private final long lockTimeoutMs;
    private final int retryAttempts;

    public LockRetryTemplate(PlatformTransactionManager transactionManager,
                             JdbcTemplate jdbcTemplate,
                             @Value("${budget.ledger.lock-timeout-ms:5000}") long lockTimeoutMs,
                             @Value("${budget.ledger.lock-retry-attempts:3}") int retryAttempts) {
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.jdbcTemplate = jdbcTemplate;
        this.lockTimeoutMs = lockTimeoutMs;
        this.retryAttempts = Math.max(1, retryAttempts);
    }

    /**
     * Executes {@code work} in a transaction whose lock waits are bounded.
     *
     * @param lockedId id of the row the work will lock, used for diagnostics
     * @param work callback that acquires the lock and performs the read-check-write
     * @throws LedgerContentionException when the lock cannot be acquired after all attempts
     */
    public <T> T execute(UUID lockedId, TransactionCallback<T> work) {
        boolean joinsOuterTransaction = TransactionSynchronizationManager.isActualTransactionActive();
        int maxAttempts = joinsOuterTransaction ? 1 : retryAttempts;

        for (int attempt = 1; ; attempt++) {
            try {
                return transactionTemplate.execute(status -> {
                    jdbcTemplate.execute("SET LOCAL lock_timeout = '" + lockTimeoutMs + "ms'");
                    return work.doInTransaction(status);
                });
            } catch (PessimisticLockingFailureException e) {
                if (attempt >= maxAttempts) {
                    log.warn("Lock on {} not acquired after {} attempt(s)", lockedId, attempt);
                    throw new LedgerContentionException(lockedId, attempt, e);
                }
                log.debug("Lock on {} timed out (attempt {}/{}), retrying", lockedId, attempt, maxAttempts);
                backoff(lockedId, attempt, e);
            }
        }
    }

    private void backoff(UUID lockedId, int attempt, PessimisticLockingFailureException cause) {
        try {
            Thread.sleep(BACKOFF_STEP_MS * attempt);
        } catch (InterruptedException interrupted) {
            Thread.currentThread().interrupt();
            throw new LedgerContentionException(lockedId, attempt, cause);
        }
    }
}
