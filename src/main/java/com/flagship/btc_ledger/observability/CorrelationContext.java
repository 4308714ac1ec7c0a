package com.flagship.btc_ledger.observability;

import java.util.UUID;

/**
 * Thread-local correlation id plus the MDC keys the ledger logs with.
 *
 * The correlation id comes from the X-Correlation-ID request header or is
 * generated, and appears on every log line of the request, including the
 * replay it triggers. transactionId is set while a single transaction is
 * being mutated or replayed.
 */
public final class CorrelationContext {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
    public static final String CORRELATION_ID_MDC_KEY = "correlationId";
    public static final String TRANSACTION_ID_MDC_KEY = "transactionId";

    private static final ThreadLocal<String> correlationId = new ThreadLocal<>();

    private CorrelationContext() {
        // Utility class
    }

    /**
     * Gets the current correlation ID, or generates a new one if not set.
     */
    public static String getCorrelationId() {
        String id = correlationId.get();
        if (id == null) {
            id = generateCorrelationId();
            correlationId.set(id);
        }
        return id;
    }

    public static void setCorrelationId(String id) {
        if (id != null && !id.isBlank()) {
            correlationId.set(id);
        } else {
            correlationId.set(generateCorrelationId());
        }
    }

    public static void clear() {
        correlationId.remove();
    }

    /**
     * Short form for readability in logs.
     */
    public static String generateCorrelationId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }
}
