package com.flagship.cash_ledger.config;

import lombok.RequiredArgsConstructor;
import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

/**
 * Kafka topics owned by the ledger.
 *
 * The ledger events topic is keyed by shift id, so events of one shift keep
 * their order within a partition.
 */
@Configuration
@RequiredArgsConstructor
public class KafkaConfig {

    private final CashLedgerProperties properties;

    @Bean
    public NewTopic ledgerEventsTopic() {
        return TopicBuilder.name(properties.getTopics().getLedgerEvents())
                .partitions(3)
                .replicas(1)
                .build();
    }
}
