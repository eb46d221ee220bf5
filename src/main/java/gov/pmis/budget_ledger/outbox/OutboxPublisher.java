package gov.pmis.budget_ledger.outbox;

import gov.pmis.budget_ledger.event.BudgetLedgerEvent;
import gov.pmis.budget_ledger.observability.OutboxMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Relays outbox events to Kafka.
 *
 * Budget line events go to the budget topic, approval events to the approval topic;
 * the aggregate id is the record key so each line's (or request's) events stay ordered
 * within a partition. Each send is awaited before the row is marked published, so
 * delivery is at-least-once.
 */
@Component
@ConditionalOnProperty(name = "outbox.publisher.enabled", havingValue = "true", matchIfMissing = true)
@Slf4j
public class OutboxPublisher {

    private final OutboxService outboxService;
    private final KafkaTemplate<String, String> kafkaTemplate;
    private final OutboxMetrics outboxMetrics;
    private final String budgetEventsTopic;
    private final String approvalEventsTopic;
    private final int batchSize;
    private final int maxRetries;

    public OutboxPublisher(OutboxService outboxService,
                           KafkaTemplate<String, String> kafkaTemplate,
                           OutboxMetrics outboxMetrics,
                           @Value("${kafka.topic.budget-events:budget-events}") String budgetEventsTopic,
                           @Value("${kafka.topic.approval-events:approval-events}") String approvalEventsTopic,
                           @Value("${outbox.publisher.batch-size:100}") int batchSize,
                           @Value("${outbox.publisher.max-retries:5}") int maxRetries) {
        this.outboxService = outboxService;
        this.kafkaTemplate = kafkaTemplate;
        this.outboxMetrics = outboxMetrics;
        this.budgetEventsTopic = budgetEventsTopic;
        this.approvalEventsTopic = approvalEventsTopic;
        this.batchSize = batchSize;
        this.maxRetries = maxRetries;
    }

    @Scheduled(fixedRateString = "${outbox.publisher.poll-interval-ms:1000}")
    public void publishPendingEvents() {
        try {
            List<OutboxEvent> events = outboxService.findPublishableEvents(batchSize, maxRetries);
            if (events.isEmpty()) {
                return;
            }

            log.debug("Found {} outbox events to relay", events.size());
            for (OutboxEvent event : events) {
                publishEvent(event);
            }
        } catch (Exception e) {
            log.error("Error in outbox publisher polling loop", e);
        }
    }

    private void publishEvent(OutboxEvent event) {
        String topic = topicFor(event);
        try {
            SendResult<String, String> result = kafkaTemplate
                    .send(topic, event.getAggregateId().toString(), event.getPayload())
                    .get();

            log.debug("Published event: eventId={}, topic={}, partition={}, offset={}, eventType={}",
                    event.getId(),
                    result.getRecordMetadata().topic(),
                    result.getRecordMetadata().partition(),
                    result.getRecordMetadata().offset(),
                    event.getEventType());

            outboxService.markPublished(event.getId());
            outboxMetrics.recordEventPublished(event.getEventType());

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while publishing event {}", event.getId());
        } catch (Exception e) {
            log.error("Failed to publish event: eventId={}, eventType={}, error={}",
                    event.getId(), event.getEventType(), e.getMessage());
            int retries = outboxService.markFailed(event.getId(), e.getMessage());
            outboxMetrics.recordEventPublishFailed(event.getEventType());

            if (retries >= maxRetries) {
                log.warn("Event {} exceeded {} retries and is dead-lettered: eventType={}, aggregateId={}",
                        event.getId(), maxRetries, event.getEventType(), event.getAggregateId());
                outboxMetrics.recordEventDeadLettered(event.getEventType());
            }
        }
    }

    String topicFor(OutboxEvent event) {
        if (BudgetLedgerEvent.APPROVAL_REQUEST_AGGREGATE.equals(event.getAggregateType())) {
            return approvalEventsTopic;
        }
        return budgetEventsTopic;
    }
}
