package com.flagship.currency_gateway.observability;

import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

/**
 * Custom health indicators for the currency gateway.
 */
public class HealthIndicators {

    /**
     * Redis holds the API keys; without it every request is rejected with 503.
     */
    @Component("apiKeyStoreHealth")
    public static class ApiKeyStoreHealthIndicator implements HealthIndicator {

        private final StringRedisTemplate redisTemplate;

        public ApiKeyStoreHealthIndicator(StringRedisTemplate redisTemplate) {
            this.redisTemplate = redisTemplate;
        }

        @Override
        public Health health() {
            RedisConnectionFactory connectionFactory = redisTemplate.getConnectionFactory();
            if (connectionFactory == null) {
                return Health.down()
                        .withDetail("error", "No connection factory configured")
                        .build();
            }

            try (RedisConnection connection = connectionFactory.getConnection()) {
                String result = connection.ping();
                if ("PONG".equals(result)) {
                    return Health.up()
                            .withDetail("response", result)
                            .build();
                }
                return Health.down()
                        .withDetail("response", result != null ? result : "null")
                        .build();

            } catch (RuntimeException e) {
                return Health.down()
                        .withDetail("error", e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName())
                        .build();
            }
        }
    }

    /**
     * Turns to RECONCILIATION_REQUIRED once an audit entry outlived a failed
     * commit. Stays there until restart; the entries must be removed by hand.
     */
    @Component("auditReconciliationHealth")
    public static class AuditReconciliationHealthIndicator implements HealthIndicator {

        static final String RECONCILIATION_REQUIRED = "RECONCILIATION_REQUIRED";

        private final TransactionMetrics metrics;

        public AuditReconciliationHealthIndicator(TransactionMetrics metrics) {
            this.metrics = metrics;
        }

        @Override
        public Health health() {
            long failures = (long) metrics.getCompensationFailureCount();
            Health.Builder builder = failures == 0
                    ? Health.up()
                    : Health.status(RECONCILIATION_REQUIRED);
            return builder
                    .withDetail("compensationFailures", failures)
                    .build();
        }
    }
}
