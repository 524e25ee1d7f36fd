package com.flagship.currency_gateway.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.currency_gateway.config.GatewayProperties;
import com.flagship.currency_gateway.exception.AccountNotFoundException;
import com.flagship.currency_gateway.exception.RemoteStoreUnavailableException;
import com.flagship.currency_gateway.exception.VersionConflictException;
import com.flagship.currency_gateway.ledger.LedgerAccount;
import com.flagship.currency_gateway.observability.TransactionMetrics;
import com.flagship.currency_gateway.support.FakeDataStoreServer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.web.reactive.function.client.WebClient;

import java.math.BigDecimal;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Data store client tests against an embedded HTTP fake.
 */
class OpenCloudDataStoreClientTest {

    private static final LedgerAccount ACCOUNT = LedgerAccount.of("1001", "main-bank");
    private static final String DATA_KEY = "1001_save_3";

    static FakeDataStoreServer server;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private OpenCloudDataStoreClient client;

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
        GatewayProperties properties = new GatewayProperties(
                new GatewayProperties.Store(server.baseUrl(), FakeDataStoreServer.API_KEY,
                        FakeDataStoreServer.UNIVERSE_ID, null, null, Duration.ofMillis(500)),
                null,
                null);
        client = new OpenCloudDataStoreClient(properties, WebClient.builder(), objectMapper,
                new TransactionMetrics(new SimpleMeterRegistry()));
    }

    @Test
    @DisplayName("Latest version comes from the ordered index of DATA/{userId}")
    void testFetchLatestVersion() {
        server.seedBalance("1001", DATA_KEY, "100");

        VersionMarker version = client.fetchLatestVersion(ACCOUNT);

        assertEquals(DATA_KEY, version.getDataKey());
        assertTrue(server.receivedApiKeys().contains(FakeDataStoreServer.API_KEY));
    }

    @Test
    @DisplayName("Empty ordered index means the account does not exist")
    void testEmptyIndex() {
        assertThrows(AccountNotFoundException.class, () -> client.fetchLatestVersion(ACCOUNT));
    }

    @Test
    @DisplayName("Non-2xx from the ordered index is a remote outage")
    void testOrderedIndexFailure() {
        server.seedBalance("1001", DATA_KEY, "100");
        server.failOrderedIndexWith(500);

        RemoteStoreUnavailableException e = assertThrows(RemoteStoreUnavailableException.class,
                () -> client.fetchLatestVersion(ACCOUNT));
        assertTrue(e.getMessage().contains("Failed to fetch entries from ordered data store"));
    }

    @Test
    @DisplayName("Balance is read together with the entry revision")
    void testReadBalance() {
        server.seedBalance("1001", DATA_KEY, "100");

        BalanceRecord record = client.readBalance(ACCOUNT, VersionMarker.of(DATA_KEY));

        assertEquals(0, new BigDecimal("100").compareTo(record.getBalance()));
        assertNotNull(record.getRevision());
        assertEquals(7, record.getDocument().get("level").asInt());
    }

    @Test
    @DisplayName("Document without the balance field reads as zero")
    void testReadMissingField() {
        server.seedDocument("1001", DATA_KEY, "{\"level\":2}");

        BalanceRecord record = client.readBalance(ACCOUNT, VersionMarker.of(DATA_KEY));

        assertEquals(0, record.getBalance().signum());
    }

    @Test
    @DisplayName("Non-numeric balance field is rejected instead of reading as zero")
    void testReadNonNumericBalance() {
        server.seedDocument("1001", DATA_KEY, "{\"bandar_ringgit\":\"100\",\"level\":3}");

        RemoteStoreUnavailableException e = assertThrows(RemoteStoreUnavailableException.class,
                () -> client.readBalance(ACCOUNT, VersionMarker.of(DATA_KEY)));

        assertEquals("Data store entry balance is not numeric", e.getMessage());
        assertEquals(0, server.acceptedWrites());
    }

    @Test
    @DisplayName("Write at the read revision replaces the whole document")
    void testConditionalWrite() throws Exception {
        server.seedBalance("1001", DATA_KEY, "100");
        VersionMarker version = VersionMarker.of(DATA_KEY);
        BalanceRecord record = client.readBalance(ACCOUNT, version);

        client.conditionalWrite(ACCOUNT, version, record.withBalance(new BigDecimal("70")));

        var stored = objectMapper.readTree(server.documentOf("1001", DATA_KEY));
        assertEquals(0, new BigDecimal("70").compareTo(stored.get("bandar_ringgit").decimalValue()));
        assertEquals(7, stored.get("level").asInt());
        assertEquals(1, server.acceptedWrites());
    }

    @Test
    @DisplayName("Write at a stale revision is a version conflict")
    void testStaleWrite() {
        server.seedBalance("1001", DATA_KEY, "100");
        VersionMarker version = VersionMarker.of(DATA_KEY);
        BalanceRecord first = client.readBalance(ACCOUNT, version);
        BalanceRecord second = client.readBalance(ACCOUNT, version);

        client.conditionalWrite(ACCOUNT, version, first.withBalance(new BigDecimal("70")));

        VersionConflictException e = assertThrows(VersionConflictException.class,
                () -> client.conditionalWrite(ACCOUNT, version, second.withBalance(new BigDecimal("50"))));
        assertTrue(e.getMessage().startsWith("Data has been modified by another process"));
        assertEquals(1, server.acceptedWrites());
        assertEquals(1, server.rejectedWrites());
    }

    @Test
    @DisplayName("Non-2xx on write other than 412 is a remote outage")
    void testWriteFailure() {
        server.seedBalance("1001", DATA_KEY, "100");
        VersionMarker version = VersionMarker.of(DATA_KEY);
        BalanceRecord record = client.readBalance(ACCOUNT, version);
        server.failWritesWith(503);

        assertThrows(RemoteStoreUnavailableException.class,
                () -> client.conditionalWrite(ACCOUNT, version, record.withBalance(BigDecimal.ONE)));
    }

    @Test
    @DisplayName("Slow reads time out as a remote outage")
    void testReadTimeout() {
        server.seedBalance("1001", DATA_KEY, "100");
        server.delayReads(2000);

        RemoteStoreUnavailableException e = assertThrows(RemoteStoreUnavailableException.class,
                () -> client.readBalance(ACCOUNT, VersionMarker.of(DATA_KEY)));
        assertTrue(e.getMessage().contains("timed out"));
    }
}
