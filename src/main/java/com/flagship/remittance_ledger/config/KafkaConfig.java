package com.flagship.remittance_ledger.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

/**
 * Declares the topic the outbox relay publishes remittance and settlement events to.
 * Events are keyed by aggregate id, so one remittance's events stay in one partition.
 */
@Configuration
public class KafkaConfig {

    @Value("${kafka.topic.remittances:remittance-events}")
    private String remittancesTopic;

    @Bean
    public NewTopic remittancesTopic() {
        return TopicBuilder.name(remittancesTopic)
                .partitions(3)
                .replicas(1)
                .build();
    }
}
