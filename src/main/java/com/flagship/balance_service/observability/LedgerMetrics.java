package com.flagship.balance_service.observability;

import com.flagship.balance_service.ledger.Ledger;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Centralized metrics for ledger operations and request handling.
 *
 * Metrics exposed:
 * - ledger.balance / ledger.bank: gauges over a consistent ledger snapshot
 * - ledger.operations: counter tagged by operation and result
 * - http.request.duration: timer tagged by route pattern, method and status
 * - http.request.instrumentation.failures: request logging that failed
 */
@Component
public class LedgerMetrics {

    private final MeterRegistry registry;
    private final Counter instrumentationFailures;

    public LedgerMetrics(MeterRegistry registry, Ledger ledger) {
        this.registry = registry;

        Gauge.builder("ledger.balance", ledger, l -> l.snapshot().getBalance())
                .description("Current spendable balance")
                .register(registry);

        Gauge.builder("ledger.bank", ledger, l -> l.snapshot().getBank())
                .description("Current amount moved to the bank")
                .register(registry);

        this.instrumentationFailures = Counter.builder("http.request.instrumentation.failures")
                .description("Request log events that could not be written")
                .register(registry);
    }

    /**
     * Records the outcome of a pay or save request.
     * Uses registry.counter() for efficient meter lookup/creation.
     */
    public void recordOperation(String operation, String result) {
        registry.counter("ledger.operations",
                "operation", sanitizeTag(operation),
                "result", sanitizeTag(result)
        ).increment();
    }

    /**
     * Records request duration.
     * The route must be a handler mapping pattern, never a raw URI.
     */
    public void recordRequestDuration(String route, String method, int statusCode, Duration duration) {
        Timer.builder("http.request.duration")
                .tag("route", sanitizeTag(route))
                .tag("method", sanitizeTag(method))
                .tag("status", String.valueOf(statusCode))
                .register(registry)
                .record(duration);
    }

    public void recordInstrumentationFailure() {
        instrumentationFailures.increment();
    }

    /**
     * Sanitizes a tag value to prevent cardinality explosion.
     */
    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_/]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
