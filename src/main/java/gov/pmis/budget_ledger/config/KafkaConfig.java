package gov.pmis.budget_ledger.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

/**
 * Topics the outbox relay writes to. Both are keyed by aggregate id.
 */
@Configuration
public class KafkaConfig {

    @Value("${kafka.topic.budget-events:budget-events}")
    private String budgetEventsTopic;

    @Value("${kafka.topic.approval-events:approval-events}")
    private String approvalEventsTopic;

    @Bean
    public NewTopic budgetEventsTopic() {
        return TopicBuilder.name(budgetEventsTopic)
                .partitions(3)
                .replicas(1)
                .build();
    }

    @Bean
    public NewTopic approvalEventsTopic() {
        return TopicBuilder.name(approvalEventsTopic)
                .partitions(3)
                .replicas(1)
                .build();
    }
}
