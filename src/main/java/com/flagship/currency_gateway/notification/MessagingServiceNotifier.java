package com.flagship.currency_gateway.notification;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.currency_gateway.config.GatewayProperties;
import com.flagship.currency_gateway.observability.TransactionMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.util.Map;

/**
 * Publishes balance changes to the cloud messaging service, where game servers
 * subscribed to the topic pick them up.
 *
 * The request is subscribed to and not awaited: the caller gets its result while
 * the publish is in flight. The publish is bounded by {@code gateway.notification.timeout}.
 */
@Component
@ConditionalOnProperty(name = "gateway.notification.transport", havingValue = "messaging-service", matchIfMissing = true)
@Slf4j
public class MessagingServiceNotifier implements BalanceChangeNotifier {

    static final String TRANSPORT = "messaging_service";

    private static final String PUBLISH_PATH = "/messaging-service/v1/universes/{universeId}/topics/{topic}";
    private static final String API_KEY_HEADER = "x-api-key";

    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final TransactionMetrics metrics;
    private final String universeId;
    private final String topic;
    private final Duration timeout;

    public MessagingServiceNotifier(GatewayProperties properties,
                                    WebClient.Builder webClientBuilder,
                                    ObjectMapper objectMapper,
                                    TransactionMetrics metrics) {
        this.objectMapper = objectMapper;
        this.metrics = metrics;
        this.universeId = properties.store().universeId();
        this.topic = properties.notification().topic();
        this.timeout = properties.notification().timeout();
        this.webClient = webClientBuilder
                .baseUrl(properties.store().baseUrl())
                .defaultHeader(API_KEY_HEADER, properties.store().apiKey())
                .build();
    }

    @Override
    public void notifyBalanceChanged(BalanceChangeNotification notification) {
        try {
            // The messaging service expects the payload as a JSON string inside "message"
            String message = objectMapper.writeValueAsString(notification);

            webClient.post()
                    .uri(PUBLISH_PATH, universeId, topic)
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(Map.of("message", message))
                    .retrieve()
                    .toBodilessEntity()
                    .timeout(timeout)
                    .subscribe(
                            response -> log.debug("Published balance change: userId={}, topic={}",
                                    notification.getUserId(), topic),
                            error -> recordFailure(notification, error));

        } catch (JsonProcessingException | RuntimeException e) {
            recordFailure(notification, e);
        }
    }

    private void recordFailure(BalanceChangeNotification notification, Throwable error) {
        log.error("Failed to send in-game update: userId={}, bankName={}, topic={}, error={}",
                notification.getUserId(), notification.getBankName(), topic, error.toString());
        metrics.incrementNotificationFailures(TRANSPORT);
    }
}
