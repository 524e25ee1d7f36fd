package com.flagship.currency_gateway.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Centralized metrics for ledger transactions.
 *
 * Metrics exposed:
 * - ledger.transactions: Counter of finished transactions, tagged by type and outcome
 * - ledger.transaction.duration: Timer for the whole protocol
 * - ledger.store.latency: Timer per remote store operation
 * - ledger.compensation.failures: Counter of audit entries that could not be rolled back
 * - ledger.notification.failures: Counter of failed downstream notifications
 */
@Component
public class TransactionMetrics {

    private final MeterRegistry registry;

    private final Counter compensationFailures;
    private final Counter notificationFailures;

    public TransactionMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.compensationFailures = Counter.builder("ledger.compensation.failures")
                .description("Audit entries left behind after a failed commit")
                .register(registry);

        this.notificationFailures = Counter.builder("ledger.notification.failures")
                .description("Downstream notifications that failed after a commit")
                .register(registry);
    }

    // ==================== Transaction Outcomes ====================

    /**
     * Records a finished transaction with its type (debit/credit) and terminal state.
     */
    public void recordTransaction(String transactionType, String outcome, long durationMs) {
        registry.counter("ledger.transactions",
                "type", sanitizeTag(transactionType),
                "outcome", sanitizeTag(outcome)
        ).increment();

        Timer.builder("ledger.transaction.duration")
                .tag("outcome", sanitizeTag(outcome))
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry)
                .record(Duration.ofMillis(durationMs));
    }

    /**
     * Records the latency of one remote store call.
     */
    public void recordStoreLatency(String operation, String status, long durationMs) {
        registry.timer("ledger.store.latency",
                "operation", sanitizeTag(operation),
                "status", sanitizeTag(status)
        ).record(Duration.ofMillis(durationMs));
    }

    public void incrementCompensationFailures() {
        compensationFailures.increment();
    }

    public double getCompensationFailureCount() {
        return compensationFailures.count();
    }

    public void incrementNotificationFailures(String transport) {
        notificationFailures.increment();
        registry.counter("ledger.notification.failures.by_transport",
                "transport", sanitizeTag(transport)
        ).increment();
    }

    // ==================== Helper Methods ====================

    /**
     * Sanitizes a tag value to prevent cardinality explosion.
     */
    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
