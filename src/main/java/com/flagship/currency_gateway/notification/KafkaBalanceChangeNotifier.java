package com.flagship.currency_gateway.notification;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.currency_gateway.config.GatewayProperties;
import com.flagship.currency_gateway.observability.TransactionMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

/**
 * Publishes balance changes to a Kafka topic, keyed by user id so that changes
 * for one user stay ordered within a partition.
 *
 * The send is not awaited; the outcome is only inspected in the completion
 * callback, where failures are logged and counted.
 */
@Component
@ConditionalOnProperty(name = "gateway.notification.transport", havingValue = "kafka")
@Slf4j
public class KafkaBalanceChangeNotifier implements BalanceChangeNotifier {

    static final String TRANSPORT = "kafka";

    private final KafkaTemplate<String, String> kafkaTemplate;
    private final ObjectMapper objectMapper;
    private final TransactionMetrics metrics;
    private final String topic;

    public KafkaBalanceChangeNotifier(KafkaTemplate<String, String> kafkaTemplate,
                                      ObjectMapper objectMapper,
                                      TransactionMetrics metrics,
                                      GatewayProperties properties) {
        this.kafkaTemplate = kafkaTemplate;
        this.objectMapper = objectMapper;
        this.metrics = metrics;
        this.topic = properties.notification().topic();
    }

    @Override
    public void notifyBalanceChanged(BalanceChangeNotification notification) {
        try {
            String payload = objectMapper.writeValueAsString(notification);

            kafkaTemplate.send(topic, notification.getUserId(), payload)
                    .whenComplete((result, error) -> {
                        if (error != null) {
                            recordFailure(notification, error);
                            return;
                        }
                        log.debug("Published balance change: userId={}, topic={}, partition={}, offset={}",
                                notification.getUserId(),
                                result.getRecordMetadata().topic(),
                                result.getRecordMetadata().partition(),
                                result.getRecordMetadata().offset());
                    });

        } catch (JsonProcessingException | RuntimeException e) {
            recordFailure(notification, e);
        }
    }

    private void recordFailure(BalanceChangeNotification notification, Throwable error) {
        log.error("Failed to publish balance change: userId={}, bankName={}, topic={}, error={}",
                notification.getUserId(), notification.getBankName(), topic, error.toString());
        metrics.incrementNotificationFailures(TRANSPORT);
    }
}
