package com.flagship.currency_gateway.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.flagship.currency_gateway.config.GatewayProperties;
import com.flagship.currency_gateway.exception.AccountNotFoundException;
import com.flagship.currency_gateway.exception.CurrencyLedgerException;
import com.flagship.currency_gateway.exception.RemoteStoreUnavailableException;
import com.flagship.currency_gateway.exception.VersionConflictException;
import com.flagship.currency_gateway.ledger.LedgerAccount;
import com.flagship.currency_gateway.observability.TransactionMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.Exceptions;
import reactor.core.publisher.Mono;

import java.util.concurrent.TimeoutException;

/**
 * {@link VersionedStore} backed by the cloud data store HTTP API.
 *
 * The latest version key comes from the ordered data store {@code DATA/{userId}}
 * (one entry, highest value first). The balance document lives in the standard
 * data store under that key; its {@code roblox-entry-version} header is sent back
 * as {@code matchVersion} on write so the store rejects stale writers with 412.
 *
 * Calls block the request thread and are bounded by {@code gateway.store.timeout}.
 */
@Component
@Slf4j
public class OpenCloudDataStoreClient implements VersionedStore {

    static final String API_KEY_HEADER = "x-api-key";
    static final String ENTRY_VERSION_HEADER = "roblox-entry-version";

    private static final String ORDERED_ENTRIES_PATH =
            "/cloud/v2/universes/{universeId}/ordered-data-stores/{dataStore}/scopes/{scope}/entries"
                    + "?maxPageSize={maxPageSize}&orderBy={orderBy}";
    private static final String ENTRY_PATH =
            "/datastores/v1/universes/{universeId}/standard-datastores/datastore/entries/entry"
                    + "?datastoreName={dataStore}&entryKey={entryKey}";
    private static final String CONDITIONAL_ENTRY_PATH = ENTRY_PATH + "&matchVersion={matchVersion}";

    private static final int LATEST_ONLY = 1;
    private static final String ORDER_BY_VALUE_DESC = "value desc";

    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final TransactionMetrics metrics;
    private final GatewayProperties.Store store;

    public OpenCloudDataStoreClient(GatewayProperties properties,
                                    WebClient.Builder webClientBuilder,
                                    ObjectMapper objectMapper,
                                    TransactionMetrics metrics) {
        this.store = properties.store();
        this.objectMapper = objectMapper;
        this.metrics = metrics;
        this.webClient = webClientBuilder
                .baseUrl(store.baseUrl())
                .defaultHeader(API_KEY_HEADER, store.apiKey())
                .build();
    }

    @Override
    public VersionMarker fetchLatestVersion(LedgerAccount account) {
        String body = call("fetch_latest_version", webClient.get()
                .uri(ORDERED_ENTRIES_PATH, store.universeId(), account.dataStoreName(), store.scope(),
                        LATEST_ONLY, ORDER_BY_VALUE_DESC)
                .accept(MediaType.APPLICATION_JSON)
                .exchangeToMono(response -> bodyOrError(response,
                        "Failed to fetch entries from ordered data store")));

        JsonNode entries = parse(body).path("orderedDataStoreEntries");
        if (!entries.isArray() || entries.isEmpty()) {
            throw new AccountNotFoundException(account.getUserId());
        }

        String dataKey = entries.get(0).path("id").asText(null);
        if (dataKey == null || dataKey.isBlank()) {
            throw new RemoteStoreUnavailableException("Ordered data store entry has no id for user " + account.getUserId());
        }

        log.debug("Latest data key resolved: dataStore={}, dataKey={}", account.dataStoreName(), dataKey);
        return VersionMarker.of(dataKey);
    }

    @Override
    public BalanceRecord readBalance(LedgerAccount account, VersionMarker version) {
        RawEntry entry = call("read_balance", webClient.get()
                .uri(ENTRY_PATH, store.universeId(), account.dataStoreName(), version.getDataKey())
                .accept(MediaType.APPLICATION_JSON)
                .exchangeToMono(response -> {
                    if (!response.statusCode().is2xxSuccessful()) {
                        return this.<RawEntry>unavailable(response, "Failed to fetch data from data store");
                    }
                    String revision = response.headers().asHttpHeaders().getFirst(ENTRY_VERSION_HEADER);
                    return response.bodyToMono(String.class)
                            .defaultIfEmpty("{}")
                            .map(body -> new RawEntry(body, revision));
                }));

        if (entry.revision() == null || entry.revision().isBlank()) {
            throw new RemoteStoreUnavailableException(
                    "Data store response carried no entry version for key " + version.getDataKey());
        }

        JsonNode document = parse(entry.body());
        if (!document.isObject()) {
            throw new RemoteStoreUnavailableException(
                    "Data store entry is not a JSON object for key " + version.getDataKey());
        }

        BalanceRecord record = BalanceRecord.of((ObjectNode) document, store.balanceField(), entry.revision());
        record.getBalance(); // rejects a non-numeric balance before any mutation
        return record;
    }

    @Override
    public void conditionalWrite(LedgerAccount account, VersionMarker version, BalanceRecord newRecord) {
        String payload;
        try {
            payload = objectMapper.writeValueAsString(newRecord.getDocument());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Balance document could not be serialized", e);
        }

        call("conditional_write", webClient.post()
                .uri(CONDITIONAL_ENTRY_PATH, store.universeId(), account.dataStoreName(),
                        version.getDataKey(), newRecord.getRevision())
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(payload)
                .exchangeToMono(response -> {
                    if (response.statusCode().value() == HttpStatus.PRECONDITION_FAILED.value()) {
                        return response.releaseBody()
                                .then(Mono.<Integer>error(new VersionConflictException(account.getUserId(), version.getDataKey())));
                    }
                    if (!response.statusCode().is2xxSuccessful()) {
                        return this.<Integer>unavailable(response, "Failed to save data to data store");
                    }
                    return response.releaseBody().thenReturn(response.statusCode().value());
                }));

        log.debug("Balance document written: dataStore={}, dataKey={}, matchVersion={}",
                account.dataStoreName(), version.getDataKey(), newRecord.getRevision());
    }

    /**
     * Blocks on the request with the configured timeout, translating transport
     * failures into {@link RemoteStoreUnavailableException} and recording latency.
     */
    private <T> T call(String operation, Mono<T> request) {
        long startTime = System.currentTimeMillis();
        String status = "success";
        try {
            return request.timeout(store.timeout()).block();
        } catch (CurrencyLedgerException e) {
            status = e.getKind().name();
            throw e;
        } catch (RuntimeException e) {
            Throwable cause = Exceptions.unwrap(e);
            if (cause instanceof TimeoutException) {
                status = "timeout";
                throw new RemoteStoreUnavailableException(
                        String.format("Data store %s timed out after %dms", operation, store.timeout().toMillis()), cause);
            }
            status = "error";
            log.warn("Data store call failed: operation={}, error={}", operation, cause.getMessage());
            throw new RemoteStoreUnavailableException("Data store " + operation + " failed: " + cause.getMessage(), cause);
        } finally {
            metrics.recordStoreLatency(operation, status, System.currentTimeMillis() - startTime);
        }
    }

    private Mono<String> bodyOrError(ClientResponse response, String failureMessage) {
        if (!response.statusCode().is2xxSuccessful()) {
            return this.<String>unavailable(response, failureMessage);
        }
        return response.bodyToMono(String.class).defaultIfEmpty("{}");
    }

    private <T> Mono<T> unavailable(ClientResponse response, String failureMessage) {
        int statusCode = response.statusCode().value();
        return response.releaseBody()
                .then(Mono.<T>error(new RemoteStoreUnavailableException(failureMessage + ": status=" + statusCode)));
    }

    private JsonNode parse(String body) {
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new RemoteStoreUnavailableException("Malformed data store response", e);
        }
    }

    private record RawEntry(String body, String revision) {
    }
}
