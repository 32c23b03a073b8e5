package com.flagship.finance_ledger.observability;

import com.flagship.finance_ledger.balance.BalanceHolderType;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Locale;

/**
 * Centralized metrics for transaction mutations.
 *
 * Metrics exposed:
 * - ledger.transactions.mutations: counter tagged with operation and outcome
 * - ledger.transactions.latency: timer per operation
 * - ledger.balance.deltas: counter of atomic balance statements, tagged by holder type
 */
@Component
public class TransactionMetrics {

    private final MeterRegistry registry;

    public TransactionMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Records a mutation outcome. Outcome is "success" or a lower-cased error code.
     */
    public void recordMutation(String operation, String outcome) {
        registry.counter("ledger.transactions.mutations",
                "operation", sanitizeTag(operation),
                "outcome", sanitizeTag(outcome)
        ).increment();
    }

    public void recordLatency(String operation, long durationMs) {
        Timer.builder("ledger.transactions.latency")
                .tag("operation", sanitizeTag(operation))
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry)
                .record(Duration.ofMillis(durationMs));
    }

    public void recordDeltaApplied(BalanceHolderType holderType) {
        registry.counter("ledger.balance.deltas",
                "holder", sanitizeTag(holderType.name())
        ).increment();
    }

    private String sanitizeTag(String value) {
        if (value == null || value.isBlank()) {
            return "unknown";
        }
        // Keep tag cardinality bounded
        String sanitized = value.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
