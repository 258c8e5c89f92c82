package com.flagship.deposit_ledger.observability;

import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.time.Duration;
import java.util.function.Supplier;

/**
 * Centralized metrics for pool operations.
 *
 * Metrics exposed:
 * - ledger.deposits: Counter of deposits, tagged by asset and status
 * - ledger.withdrawals: Counter of withdrawals, tagged by asset and status
 * - ledger.rate_changes: Counter of interest rate updates
 * - ledger.operation.latency: Timer per operation
 * - ledger.index: Gauge of each market's previewed index, as a decimal growth factor
 */
@Component
public class LedgerMetrics {

    private static final double INDEX_SCALE = 1e18;

    private final MeterRegistry registry;

    public LedgerMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordDeposit(String assetId, String status) {
        registry.counter("ledger.deposits",
                "asset", sanitizeTag(assetId),
                "status", sanitizeTag(status)
        ).increment();
    }

    public void recordWithdrawal(String assetId, String status) {
        registry.counter("ledger.withdrawals",
                "asset", sanitizeTag(assetId),
                "status", sanitizeTag(status)
        ).increment();
    }

    public void recordRateChange(String assetId) {
        registry.counter("ledger.rate_changes", "asset", sanitizeTag(assetId)).increment();
    }

    public void recordLatency(String operation, long durationMs) {
        registry.timer("ledger.operation.latency",
                "operation", sanitizeTag(operation)
        ).record(Duration.ofMillis(durationMs));
    }

    /**
     * Registers a gauge that reads the market's index on each scrape.
     */
    public void registerIndexGauge(String assetId, Supplier<BigInteger> indexSupplier) {
        Gauge.builder("ledger.index", indexSupplier, s -> s.get().doubleValue() / INDEX_SCALE)
                .description("Interest index growth factor since market creation")
                .tag("asset", sanitizeTag(assetId))
                .strongReference(true)
                .register(registry);
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
