package com.flagship.currency_gateway.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

/**
 * Kafka configuration, active only when balance changes are published to Kafka.
 *
 * Declares the notification topic. Partitions are keyed by user id.
 */
@Configuration
@ConditionalOnProperty(name = "gateway.notification.transport", havingValue = "kafka")
public class KafkaConfig {

    @Bean
    public NewTopic balanceChangeTopic(GatewayProperties properties) {
        return TopicBuilder.name(properties.notification().topic())
                .partitions(3)
                .replicas(1)
                .build();
    }
}
