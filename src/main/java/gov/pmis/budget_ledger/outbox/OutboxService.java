package gov.pmis.budget_ledger.outbox;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import gov.pmis.budget_ledger.event.BudgetLedgerEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;

/**
 * Writes ledger and workflow events to the outbox table.
 *
 * Writes join the caller's transaction (MANDATORY): an event exists if and only if
 * the change it describes committed. Relay bookkeeping runs in its own transactions.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class OutboxService {

    private final OutboxEventRepository repository;
    private final ObjectMapper objectMapper;

    @Transactional(propagation = Propagation.MANDATORY)
    public OutboxEvent saveEvent(BudgetLedgerEvent event) {
        OutboxEvent outboxEvent = OutboxEvent.create(
            event.getAggregateType(),
            event.getAggregateId(),
            event.getEventType(),
            serializePayload(event)
        );

        OutboxEventEntity saved = repository.save(OutboxEventEntity.fromDomain(outboxEvent));

        log.debug("Saved outbox event: type={}, aggregateType={}, aggregateId={}",
                event.getEventType(), event.getAggregateType(), event.getAggregateId());

        return saved.toDomain();
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public List<OutboxEvent> findPublishableEvents(int limit, int maxRetries) {
        return repository.findPublishableForUpdate(limit, maxRetries)
                .stream()
                .map(OutboxEventEntity::toDomain)
                .toList();
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void markPublished(UUID eventId) {
        repository.findById(eventId).ifPresent(entity -> {
            entity.markPublished();
            repository.save(entity);
            log.debug("Marked event {} as published", eventId);
        });
    }

    /**
     * Records a failed relay attempt.
     *
     * @return the retry count after this failure, or 0 when the event no longer exists
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public int markFailed(UUID eventId, String errorMessage) {
        return repository.findById(eventId)
                .map(entity -> {
                    entity.markFailed(errorMessage);
                    repository.save(entity);
                    log.warn("Marked event {} as failed (retry #{}): {}",
                            eventId, entity.getRetryCount(), errorMessage);
                    return entity.getRetryCount();
                })
                .orElse(0);
    }

    @Transactional(readOnly = true)
    public List<OutboxEvent> getEventsForAggregate(String aggregateType, UUID aggregateId) {
        return repository.findByAggregateTypeAndAggregateIdOrderBySequenceNumberAsc(aggregateType, aggregateId)
                .stream()
                .map(OutboxEventEntity::toDomain)
                .toList();
    }

    private String serializePayload(BudgetLedgerEvent event) {
        try {
            return objectMapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize event payload: " + event.getEventType(), e);
        }
    }
}
