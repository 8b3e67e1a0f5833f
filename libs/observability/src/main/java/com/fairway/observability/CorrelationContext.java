package com.fairway.observability;

import java.util.UUID;

/**
 * Identifiers attached to one unit of work (an HTTP request, a batch item, a signal push).
 * <p>
 * Populated once at the edge and copied into SLF4J MDC by {@link CorrelationContextHolder}, so
 * every log line written while serving a tenant carries the tenant and the caller.
 *
 * @param correlationId id shared by every log line and span of the flow
 * @param tenantId      tenant being served, {@code null} for platform-wide work
 * @param userId        acting user, {@code null} for scheduled or system work
 * @param requestId     id of this particular request within the flow
 */
public record CorrelationContext(
        String correlationId,
        String tenantId,
        String userId,
        String requestId
) {

    public static final String MDC_CORRELATION_ID = "correlationId";
    public static final String MDC_TENANT_ID = "tenantId";
    public static final String MDC_USER_ID = "userId";
    public static final String MDC_REQUEST_ID = "requestId";

    public CorrelationContext {
        if (correlationId == null || correlationId.isBlank()) {
            throw new IllegalArgumentException("correlationId must not be null or blank");
        }
    }

    /**
     * Starts a new platform-level context with a random correlation id.
     */
    public static CorrelationContext newRoot() {
        String id = UUID.randomUUID().toString();
        return new CorrelationContext(id, null, null, id);
    }

    /**
     * Returns a copy scoped to the given tenant.
     */
    public CorrelationContext forTenant(String tenant) {
        return new CorrelationContext(correlationId, tenant, userId, requestId);
    }
}
