package com.flagship.currency_gateway.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;

import java.time.Duration;

/**
 * Typed configuration for the gateway, bound from the {@code gateway.*} namespace.
 *
 * Missing optional values fall back to the defaults of the original deployment
 * (global scope, {@code bandar_ringgit} balance field, {@code UpdateCurrency} topic).
 */
@ConfigurationProperties(prefix = "gateway")
public record GatewayProperties(
        Store store,
        Notification notification,
        Auth auth
) {

    @ConstructorBinding
    public GatewayProperties {
        if (store == null) {
            throw new IllegalArgumentException("gateway.store configuration must be provided");
        }
        if (notification == null) {
            notification = new Notification(null, null, null);
        }
        if (auth == null) {
            auth = new Auth(null);
        }
    }

    /**
     * Remote data store holding the balances.
     */
    public record Store(
            String baseUrl,
            String apiKey,
            String universeId,
            String scope,
            String balanceField,
            Duration timeout
    ) {
        public Store {
            if (baseUrl == null || baseUrl.isBlank()) {
                throw new IllegalArgumentException("gateway.store.base-url must be provided");
            }
            if (universeId == null || universeId.isBlank()) {
                throw new IllegalArgumentException("gateway.store.universe-id must be provided");
            }
            if (apiKey == null) {
                apiKey = "";
            }
            if (scope == null || scope.isBlank()) {
                scope = "global";
            }
            if (balanceField == null || balanceField.isBlank()) {
                balanceField = "bandar_ringgit";
            }
            if (timeout == null || timeout.isZero() || timeout.isNegative()) {
                timeout = Duration.ofSeconds(5);
            }
        }
    }

    public record Notification(
            NotificationTransport transport,
            String topic,
            Duration timeout
    ) {
        public Notification {
            if (transport == null) {
                transport = NotificationTransport.MESSAGING_SERVICE;
            }
            if (topic == null || topic.isBlank()) {
                topic = "UpdateCurrency";
            }
            if (timeout == null || timeout.isZero() || timeout.isNegative()) {
                timeout = Duration.ofSeconds(5);
            }
        }
    }

    public record Auth(String apiKeyPrefix) {
        public Auth {
            if (apiKeyPrefix == null) {
                apiKeyPrefix = "api-key:";
            }
        }
    }

    public enum NotificationTransport {
        MESSAGING_SERVICE,
        KAFKA,
        NONE
    }
}
