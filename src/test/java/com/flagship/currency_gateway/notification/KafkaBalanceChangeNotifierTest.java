package com.flagship.currency_gateway.notification;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.currency_gateway.config.GatewayProperties;
import com.flagship.currency_gateway.observability.TransactionMetrics;
import com.flagship.currency_gateway.transaction.TransactionType;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.clients.producer.RecordMetadata;
import org.apache.kafka.common.KafkaException;
import org.apache.kafka.common.TopicPartition;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;

import java.math.BigDecimal;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Kafka transport with a mocked template.
 */
@ExtendWith(MockitoExtension.class)
class KafkaBalanceChangeNotifierTest {

    private static final String TOPIC = "UpdateCurrency";

    @Mock
    private KafkaTemplate<String, String> kafkaTemplate;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private SimpleMeterRegistry registry;
    private KafkaBalanceChangeNotifier notifier;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        GatewayProperties properties = new GatewayProperties(
                new GatewayProperties.Store("http://localhost", "", "1", null, null, null),
                new GatewayProperties.Notification(GatewayProperties.NotificationTransport.KAFKA, TOPIC, null),
                null);
        notifier = new KafkaBalanceChangeNotifier(kafkaTemplate, objectMapper, new TransactionMetrics(registry), properties);
    }

    @Test
    @DisplayName("Balance change is sent keyed by user id")
    void testSend() throws Exception {
        ProducerRecord<String, String> record = new ProducerRecord<>(TOPIC, "1001", "{}");
        RecordMetadata metadata = new RecordMetadata(new TopicPartition(TOPIC, 0), 5L, 0, 0L, 4, 2);
        when(kafkaTemplate.send(eq(TOPIC), eq("1001"), anyString()))
                .thenReturn(CompletableFuture.completedFuture(new SendResult<>(record, metadata)));

        notifier.notifyBalanceChanged(
                new BalanceChangeNotification("1001", new BigDecimal("25"), "main-bank", TransactionType.CREDIT));

        ArgumentCaptor<String> payload = ArgumentCaptor.forClass(String.class);
        verify(kafkaTemplate).send(eq(TOPIC), eq("1001"), payload.capture());
        JsonNode message = objectMapper.readTree(payload.getValue());
        assertEquals("main-bank", message.get("bankName").asText());
        assertEquals("credit", message.get("transactionType").asText());
        assertEquals(0.0, registry.get("ledger.notification.failures").counter().count());
    }

    @Test
    @DisplayName("Failed send is counted, not thrown")
    void testSendFailure() {
        when(kafkaTemplate.send(eq(TOPIC), eq("1001"), anyString()))
                .thenReturn(CompletableFuture.failedFuture(new KafkaException("broker down")));

        assertDoesNotThrow(() -> notifier.notifyBalanceChanged(
                new BalanceChangeNotification("1001", BigDecimal.ONE, "main-bank", TransactionType.DEBIT)));

        assertEquals(1.0, registry.get("ledger.notification.failures").counter().count());
        assertEquals(1.0, registry.get("ledger.notification.failures.by_transport")
                .tag("transport", KafkaBalanceChangeNotifier.TRANSPORT).counter().count());
    }
}
