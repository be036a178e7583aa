package com.flagship.remittance_ledger.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Engine metrics.
 *
 * <ul>
 *   <li>{@code remittance.created} by direction and currency</li>
 *   <li>{@code settlement.attempts} by outcome (success, insufficient_funds, invalid_state, ...)</li>
 *   <li>{@code settlement.duration} including retries</li>
 *   <li>{@code settlement.retries} lock-conflict retries</li>
 *   <li>{@code autosettle.runs} by strategy and outcome</li>
 *   <li>{@code cash_balance.drift} refreshes that found stored balance out of line with entries</li>
 * </ul>
 */
@Component
public class SettlementMetrics {

    private final MeterRegistry registry;
    private final Timer settlementTimer;
    private final Counter retries;
    private final Counter duplicateRequests;

    public SettlementMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.settlementTimer = Timer.builder("settlement.duration")
                .description("Time taken to settle one outgoing/incoming pair, retries included")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry);

        this.retries = Counter.builder("settlement.retries")
                .description("Settlement attempts retried after a lock conflict")
                .register(registry);

        this.duplicateRequests = Counter.builder("remittance.duplicate_requests")
                .description("Remittance creations answered from an idempotency key")
                .register(registry);
    }

    public void recordRemittanceCreated(String direction, String currency) {
        registry.counter("remittance.created",
                "direction", sanitizeTag(direction),
                "currency", sanitizeTag(currency)
        ).increment();
    }

    public void recordSettlementOutcome(String outcome) {
        registry.counter("settlement.attempts", "outcome", sanitizeTag(outcome)).increment();
    }

    public void recordSettlementDuration(Duration duration) {
        settlementTimer.record(duration);
    }

    public void incrementRetries() {
        retries.increment();
    }

    public void recordAutoSettle(String strategy, String outcome) {
        registry.counter("autosettle.runs",
                "strategy", sanitizeTag(strategy),
                "outcome", sanitizeTag(outcome)
        ).increment();
    }

    public void recordBalanceDrift(String currency) {
        registry.counter("cash_balance.drift", "currency", sanitizeTag(currency)).increment();
    }

    public void recordIdempotencyHit() {
        duplicateRequests.increment();
        registry.counter("idempotency.cache", "result", "hit").increment();
    }

    public void recordIdempotencyMiss() {
        registry.counter("idempotency.cache", "result", "miss").increment();
    }

    public void recordApiLatency(String operation, Duration duration) {
        registry.timer("remittance.api.duration", "operation", sanitizeTag(operation)).record(duration);
    }

    private static String sanitizeTag(String value) {
        if (value == null || value.isBlank()) {
            return "unknown";
        }
        String sanitized = value.toLowerCase().replaceAll("[^a-z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
