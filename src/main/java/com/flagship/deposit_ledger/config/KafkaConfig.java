package com.flagship.deposit_ledger.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.apache.kafka.common.config.TopicConfig;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

/**
 * Declares the ledger events topic. Only active while the outbox relay runs,
 * so tests and relay-less deployments never contact a broker.
 */
@Configuration
@ConditionalOnProperty(name = "outbox.publisher.enabled", havingValue = "true", matchIfMissing = true)
public class KafkaConfig {

    /**
     * Records are keyed by asset ID, so each market's events land on one
     * partition in order.
     */
    @Bean
    public NewTopic ledgerEventsTopic(@Value("${kafka.topic.ledger:ledger-events}") String topic,
                                      @Value("${kafka.topic.partitions:3}") int partitions) {
        return TopicBuilder.name(topic)
                .partitions(partitions)
                .replicas(1)
                .config(TopicConfig.CLEANUP_POLICY_CONFIG, TopicConfig.CLEANUP_POLICY_DELETE)
                .build();
    }
}
