package com.flagship.deposit_ledger.observability;

import org.slf4j.MDC;

import java.util.UUID;

/**
 * MDC keys shared by the request filter, the pool and the outbox.
 *
 * The correlation ID set for an HTTP request is also stamped on every outbox
 * event written while serving it, and travels to Kafka as a record header.
 */
public final class CorrelationContext {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
    public static final String CORRELATION_ID_MDC_KEY = "correlationId";
    public static final String ASSET_ID_MDC_KEY = "assetId";
    public static final String USER_ID_MDC_KEY = "userId";

    private CorrelationContext() {
    }

    /**
     * Correlation ID of the current thread, or null outside a request.
     */
    public static String currentCorrelationId() {
        return MDC.get(CORRELATION_ID_MDC_KEY);
    }

    /**
     * Uses the caller's ID when supplied, otherwise a short random one.
     */
    public static String resolveCorrelationId(String requested) {
        if (requested != null && !requested.isBlank()) {
            return requested.trim();
        }
        return UUID.randomUUID().toString().substring(0, 8);
    }

    /**
     * Tags log lines with the market and user for the duration of a pool
     * operation. Closing it restores whatever tags were there before.
     */
    public static OperationScope forOperation(String assetId, String userId) {
        String previousAsset = MDC.get(ASSET_ID_MDC_KEY);
        String previousUser = MDC.get(USER_ID_MDC_KEY);
        MDC.put(ASSET_ID_MDC_KEY, assetId);
        MDC.put(USER_ID_MDC_KEY, userId);
        return () -> {
            restore(ASSET_ID_MDC_KEY, previousAsset);
            restore(USER_ID_MDC_KEY, previousUser);
        };
    }

    private static void restore(String key, String previous) {
        if (previous == null) {
            MDC.remove(key);
        } else {
            MDC.put(key, previous);
        }
    }

    @FunctionalInterface
    public interface OperationScope extends AutoCloseable {
        @Override
        void close();
    }
}
