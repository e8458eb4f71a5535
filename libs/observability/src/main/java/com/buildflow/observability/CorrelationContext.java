package com.buildflow.observability;

/**
 * Immutable per-request context used for log correlation.
 * <p>
 * The web layer creates one as soon as a request arrives (correlation id only) and enriches it
 * once the session token has been verified (user id, agency database). Values are mirrored into
 * the SLF4J MDC by {@link CorrelationContextHolder}, so every log line written while handling the
 * request carries them.
 *
 * @param correlationId  id of the business flow, echoed back in {@code X-Correlation-ID}
 * @param agencyDatabase tenant database the request is routed to (nullable before authentication)
 * @param userId         authenticated user (nullable for anonymous requests)
 * @param requestId      id of this specific request
 */
public record CorrelationContext(
        String correlationId,
        String agencyDatabase,
        String userId,
        String requestId
) {

    public static final String MDC_CORRELATION_ID = "correlationId";
    public static final String MDC_AGENCY_DATABASE = "agencyDatabase";
    public static final String MDC_USER_ID = "userId";
    public static final String MDC_REQUEST_ID = "requestId";

    public CorrelationContext {
        if (correlationId == null || correlationId.isBlank()) {
            throw new IllegalArgumentException("correlationId must not be null or blank");
        }
    }

    /**
     * Context for a request that has not been authenticated yet.
     */
    public static CorrelationContext anonymous(String correlationId, String requestId) {
        return new CorrelationContext(correlationId, null, null, requestId);
    }

    /**
     * Returns a copy bound to the given user and agency database.
     */
    public CorrelationContext withPrincipal(String userId, String agencyDatabase) {
        return new CorrelationContext(correlationId, agencyDatabase, userId, requestId);
    }
}
