package com.flagship.credit_ledger.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

/**
 * Topic for ledger events published from the outbox. Events are keyed by
 * user id, so all events for one user land on one partition in order.
 */
@Configuration
public class KafkaConfig {

    @Bean
    public NewTopic ledgerEventsTopic(LedgerProperties properties) {
        return TopicBuilder.name(properties.getEvents().getTopic())
                .partitions(properties.getEvents().getPartitions())
                .replicas(1)
                .build();
    }
}
