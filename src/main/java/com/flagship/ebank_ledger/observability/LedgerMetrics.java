package com.flagship.ebank_ledger.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Centralized metrics for ledger and account operations.
 *
 * Metrics exposed:
 * - ledger.operations: Counter of ledger operations, tagged by type and outcome
 * - ledger.latency: Timer of ledger operations, tagged by operation
 * - accounts.created: Counter of opened accounts
 * - idempotency.cache: Counter of idempotency key lookups, tagged hit/miss
 */
@Component
public class LedgerMetrics {

    private final MeterRegistry registry;

    private final Counter accountsCreated;

    public LedgerMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.accountsCreated = Counter.builder("accounts.created")
                .description("Number of accounts opened")
                .register(registry);
    }

    public void incrementAccountsCreated() {
        accountsCreated.increment();
    }

    /**
     * Records a ledger operation with its transaction type and outcome
     * ("success" or the error code).
     */
    public void recordOperation(String type, String outcome) {
        registry.counter("ledger.operations",
                "type", sanitizeTag(type),
                "outcome", sanitizeTag(outcome)
        ).increment();
    }

    public void recordLatency(String operation, long durationMs) {
        registry.timer("ledger.latency",
                "operation", sanitizeTag(operation)
        ).record(Duration.ofMillis(durationMs));
    }

    public void recordIdempotencyHit() {
        registry.counter("idempotency.cache", "result", "hit").increment();
    }

    public void recordIdempotencyMiss() {
        registry.counter("idempotency.cache", "result", "miss").increment();
    }

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
