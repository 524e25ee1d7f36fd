package com.flagship.currency_gateway.notification;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.currency_gateway.config.GatewayProperties;
import com.flagship.currency_gateway.observability.TransactionMetrics;
import com.flagship.currency_gateway.support.FakeDataStoreServer;
import com.flagship.currency_gateway.transaction.TransactionType;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.web.reactive.function.client.WebClient;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Messaging service publishing against the embedded fake.
 */
class MessagingServiceNotifierTest {

    static FakeDataStoreServer server;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private SimpleMeterRegistry registry;
    private MessagingServiceNotifier notifier;

    @BeforeAll
    static void start() {
        server = new FakeDataStoreServer().start();
    }

    @AfterAll
    static void stop() {
        server.stop();
    }

    @BeforeEach
    void setUp() {
        server.reset();
        registry = new SimpleMeterRegistry();
        GatewayProperties properties = new GatewayProperties(
                new GatewayProperties.Store(server.baseUrl(), FakeDataStoreServer.API_KEY,
                        FakeDataStoreServer.UNIVERSE_ID, null, null, null),
                new GatewayProperties.Notification(GatewayProperties.NotificationTransport.MESSAGING_SERVICE,
                        null, Duration.ofSeconds(2)),
                null);
        notifier = new MessagingServiceNotifier(properties, WebClient.builder(), objectMapper,
                new TransactionMetrics(registry));
    }

    private static void await(BooleanSupplier condition) throws InterruptedException {
        for (int i = 0; i < 60 && !condition.getAsBoolean(); i++) {
            Thread.sleep(50);
        }
    }

    @Test
    @DisplayName("Notification is published as a JSON string inside 'message'")
    void testPublish() throws Exception {
        notifier.notifyBalanceChanged(
                new BalanceChangeNotification("1001", new BigDecimal("30"), "main-bank", TransactionType.CREDIT));

        await(() -> !server.publishedMessages().isEmpty());

        assertEquals(1, server.publishedMessages().size());
        JsonNode envelope = objectMapper.readTree(server.publishedMessages().get(0));
        JsonNode message = objectMapper.readTree(envelope.get("message").asText());
        assertEquals("1001", message.get("userId").asText());
        assertEquals("credit", message.get("transactionType").asText());
        assertEquals(30, message.get("amount").asInt());
        assertTrue(server.receivedApiKeys().contains(FakeDataStoreServer.API_KEY));
    }

    @Test
    @DisplayName("Rejected publish is counted and never thrown to the caller")
    void testPublishFailure() throws Exception {
        server.failMessagingWith(500);

        assertDoesNotThrow(() -> notifier.notifyBalanceChanged(
                new BalanceChangeNotification("1001", BigDecimal.TEN, "main-bank", TransactionType.DEBIT)));

        await(() -> registry.get("ledger.notification.failures").counter().count() > 0);
        assertEquals(1.0, registry.get("ledger.notification.failures").counter().count());
        assertEquals(1.0, registry.get("ledger.notification.failures.by_transport")
                .tag("transport", MessagingServiceNotifier.TRANSPORT).counter().count());
    }
}
