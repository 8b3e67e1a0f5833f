package com.fairway.observability;

import org.slf4j.MDC;

import java.util.Optional;
import java.util.function.Supplier;

/**
 * Thread-local holder for {@link CorrelationContext} that mirrors the context into SLF4J MDC.
 * <p>
 * Work handed to another thread does not inherit the context; wrap it with
 * {@link #propagate(Supplier)} at submission time.
 */
public final class CorrelationContextHolder {

    private static final ThreadLocal<CorrelationContext> CONTEXT = new ThreadLocal<>();

    private CorrelationContextHolder() {
        // utility class
    }

    /**
     * Binds the context to the current thread and populates MDC.
     *
     * @throws IllegalArgumentException if context is null
     */
    public static void set(CorrelationContext context) {
        if (context == null) {
            throw new IllegalArgumentException("context must not be null");
        }
        CONTEXT.set(context);
        putOrRemove(CorrelationContext.MDC_CORRELATION_ID, context.correlationId());
        putOrRemove(CorrelationContext.MDC_TENANT_ID, context.tenantId());
        putOrRemove(CorrelationContext.MDC_USER_ID, context.userId());
        putOrRemove(CorrelationContext.MDC_REQUEST_ID, context.requestId());
    }

    public static Optional<CorrelationContext> get() {
        return Optional.ofNullable(CONTEXT.get());
    }

    /**
     * Returns the correlation id of the current context, or {@code null} when none is bound.
     */
    public static String currentCorrelationId() {
        CorrelationContext ctx = CONTEXT.get();
        return ctx == null ? null : ctx.correlationId();
    }

    public static void clear() {
        CONTEXT.remove();
        MDC.remove(CorrelationContext.MDC_CORRELATION_ID);
        MDC.remove(CorrelationContext.MDC_TENANT_ID);
        MDC.remove(CorrelationContext.MDC_USER_ID);
        MDC.remove(CorrelationContext.MDC_REQUEST_ID);
    }

    /**
     * Runs {@code work} with {@code context} bound, restoring whatever was bound before.
     */
    public static <T> T callWithContext(CorrelationContext context, Supplier<T> work) {
        CorrelationContext previous = CONTEXT.get();
        try {
            set(context);
            return work.get();
        } finally {
            if (previous != null) {
                set(previous);
            } else {
                clear();
            }
        }
    }

    /**
     * Captures the caller's context now and re-binds it around {@code work} wherever it later
     * runs. Returns {@code work} unchanged when the caller has no context.
     */
    public static <T> Supplier<T> propagate(Supplier<T> work) {
        CorrelationContext captured = CONTEXT.get();
        if (captured == null) {
            return work;
        }
        return () -> callWithContext(captured, work);
    }

    private static void putOrRemove(String key, String value) {
        if (value != null) {
            MDC.put(key, value);
        } else {
            MDC.remove(key);
        }
    }
}
