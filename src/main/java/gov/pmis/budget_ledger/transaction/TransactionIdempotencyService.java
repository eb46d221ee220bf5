package gov.pmis.budget_ledger.transaction;

import gov.pmis.budget_ledger.exception.ValidationException;
import gov.pmis.budget_ledger.ledger.store.LedgerStore;
import gov.pmis.budget_ledger.observability.BudgetMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Optional;
import java.util.UUID;

/**
 * Idempotency-Key lookups for recorded transactions.
 *
 * Redis is a fast path only. The unique idempotency_key column in the ledger is the
 * source of truth, and the processor repeats the lookup under the line lock, so a
 * Redis outage or a stale entry never lets a key record twice.
 */
@Service
@Slf4j
public class TransactionIdempotencyService {

    private static final String REDIS_KEY_PREFIX = "budget-tx-idempotency:";

    private final LedgerStore store;
    private final Optional<StringRedisTemplate> redisTemplate;
    private final BudgetMetrics metrics;
    private final Duration ttl;

    public TransactionIdempotencyService(LedgerStore store,
                                         Optional<StringRedisTemplate> redisTemplate,
                                         BudgetMetrics metrics,
                                         @Value("${budget.idempotency.ttl:P7D}") Duration ttl) {
        this.store = store;
        this.redisTemplate = redisTemplate;
        this.metrics = metrics;
        this.ttl = ttl;
    }

    /**
     * Transaction id previously recorded under {@code idempotencyKey}, if any.
     */
    public Optional<UUID> lookup(String idempotencyKey) {
        requireKey(idempotencyKey);

        if (redisTemplate.isPresent()) {
            try {
                String cached = redisTemplate.get().opsForValue().get(REDIS_KEY_PREFIX + idempotencyKey);
                if (cached != null) {
                    metrics.recordIdempotencyHit();
                    return Optional.of(UUID.fromString(cached));
                }
            } catch (Exception e) {
                log.warn("Redis lookup failed for idempotency key {}, using ledger store: {}",
                    idempotencyKey, e.getMessage());
            }
        }

        metrics.recordIdempotencyMiss();
        Optional<UUID> stored = store.findTransactionByIdempotencyKey(idempotencyKey)
            .map(BudgetTransaction::getId);
        stored.ifPresent(transactionId -> cache(idempotencyKey, transactionId));
        return stored;
    }

    /**
     * Caches the key for later lookups. The ledger row already holds the key.
     */
    public void remember(String idempotencyKey, UUID transactionId) {
        requireKey(idempotencyKey);
        cache(idempotencyKey, transactionId);
    }

    private void cache(String idempotencyKey, UUID transactionId) {
        if (redisTemplate.isEmpty()) {
            return;
        }
        try {
            redisTemplate.get().opsForValue().set(REDIS_KEY_PREFIX + idempotencyKey, transactionId.toString(), ttl);
        } catch (Exception e) {
            log.warn("Failed to cache idempotency key {} in Redis: {}", idempotencyKey, e.getMessage());
        }
    }

    private static void requireKey(String idempotencyKey) {
        if (idempotencyKey == null || idempotencyKey.isBlank()) {
            throw new ValidationException("Idempotency-Key is required");
        }
    }
}
