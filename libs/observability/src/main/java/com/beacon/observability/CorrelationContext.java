package com.beacon.observability;

/**
 * Immutable per-request context copied into SLF4J MDC so that every log line of a request,
 * including probe failures, can be traced back to it.
 *
 * @param correlationId unique ID for the request (propagated from {@code X-Correlation-ID} when present)
 * @param endpoint      request path being served (nullable outside HTTP handling)
 * @param clientAddress remote address of the caller (nullable)
 */
public record CorrelationContext(String correlationId, String endpoint, String clientAddress) {

    /** MDC key for correlation ID. */
    public static final String MDC_CORRELATION_ID = "correlationId";

    /** MDC key for the request path. */
    public static final String MDC_ENDPOINT = "endpoint";

    /** MDC key for the client address. */
    public static final String MDC_CLIENT_ADDRESS = "clientAddress";

    public CorrelationContext {
        if (correlationId == null || correlationId.isBlank()) {
            throw new IllegalArgumentException("correlationId must not be null or blank");
        }
    }
}
