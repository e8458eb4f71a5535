package com.buildflow.observability;

import org.slf4j.MDC;

import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Thread-local holder for {@link CorrelationContext} with an SLF4J MDC bridge.
 * <p>
 * Servlet requests are served on pooled worker threads, so whoever sets a context must clear it
 * in a {@code finally} block. Work handed to another thread has to carry the context explicitly,
 * see {@link #runWithContext(CorrelationContext, Runnable)}.
 */
public final class CorrelationContextHolder {

    private static final ThreadLocal<CorrelationContext> CONTEXT = new ThreadLocal<>();

    private CorrelationContextHolder() {
        // utility class
    }

    /**
     * Sets the context for the current thread and populates the MDC.
     *
     * @throws IllegalArgumentException if context is null
     */
    public static void set(CorrelationContext context) {
        if (context == null) {
            throw new IllegalArgumentException("context must not be null");
        }
        CONTEXT.set(context);
        populateMdc(context);
    }

    public static Optional<CorrelationContext> get() {
        return Optional.ofNullable(CONTEXT.get());
    }

    /**
     * Replaces the current context with {@code updater.apply(current)}. No-op when no context
     * is set on this thread.
     */
    public static void update(UnaryOperator<CorrelationContext> updater) {
        CorrelationContext current = CONTEXT.get();
        if (current != null) {
            set(updater.apply(current));
        }
    }

    /**
     * Returns the correlation id of the current thread, or {@code null}.
     */
    public static String currentCorrelationId() {
        CorrelationContext ctx = CONTEXT.get();
        return ctx != null ? ctx.correlationId() : null;
    }

    public static void clear() {
        CONTEXT.remove();
        MDC.remove(CorrelationContext.MDC_CORRELATION_ID);
        MDC.remove(CorrelationContext.MDC_AGENCY_DATABASE);
        MDC.remove(CorrelationContext.MDC_USER_ID);
        MDC.remove(CorrelationContext.MDC_REQUEST_ID);
    }

    /**
     * Runs {@code runnable} with the given context, then restores the previous one (or clears
     * the thread when there was none).
     */
    public static void runWithContext(CorrelationContext context, Runnable runnable) {
        CorrelationContext previous = CONTEXT.get();
        try {
            set(context);
            runnable.run();
        } finally {
            if (previous != null) {
                set(previous);
            } else {
                clear();
            }
        }
    }

    private static void populateMdc(CorrelationContext ctx) {
        putOrRemove(CorrelationContext.MDC_CORRELATION_ID, ctx.correlationId());
        putOrRemove(CorrelationContext.MDC_AGENCY_DATABASE, ctx.agencyDatabase());
        putOrRemove(CorrelationContext.MDC_USER_ID, ctx.userId());
        putOrRemove(CorrelationContext.MDC_REQUEST_ID, ctx.requestId());
    }

    private static void putOrRemove(String key, String value) {
        if (value != null) {
            MDC.put(key, value);
        } else {
            MDC.remove(key);
        }
    }
}
