package com.hermes.engine.logging;

import org.slf4j.MDC;
import java.util.UUID;

/**
 * MDC (Mapped Diagnostic Context) helper for structured logging.
 * Ensures all logs include the entity being worked on and a trace ID.
 *
 * Usage:
 * <pre>
 * try (var ctx = LoggingContext.forHost(hostname)) {
 *     log.info("Deleting host"); // Automatically includes hostname
 * }
 * </pre>
 */
public final class LoggingContext implements AutoCloseable {

    public static final String HOSTNAME = "hostname";
    public static final String EVENT_TYPE_ID = "eventTypeId";
    public static final String OPERATION = "operation";
    public static final String TRACE_ID = "traceId";

    private LoggingContext() {
        // Private constructor - use static factory methods
    }

    /**
     * Create a logging context for host-level operations.
     */
    public static LoggingContext forHost(String hostname) {
        return forHost(hostname, null);
    }

    /**
     * Create a logging context for host-level operations.
     */
    public static LoggingContext forHost(String hostname, String operation) {
        LoggingContext ctx = new LoggingContext();
        if (hostname != null) {
            MDC.put(HOSTNAME, hostname);
        }
        if (operation != null) {
            MDC.put(OPERATION, operation);
        }
        ensureTraceId();
        return ctx;
    }

    /**
     * Create a logging context for event-type operations.
     */
    public static LoggingContext forEventType(Long eventTypeId, String operation) {
        LoggingContext ctx = new LoggingContext();
        if (eventTypeId != null) {
            MDC.put(EVENT_TYPE_ID, eventTypeId.toString());
        }
        if (operation != null) {
            MDC.put(OPERATION, operation);
        }
        ensureTraceId();
        return ctx;
    }

    /**
     * Use an externally supplied trace ID, e.g. from a request header.
     */
    public static void setTraceId(String traceId) {
        if (traceId != null && !traceId.isBlank()) {
            MDC.put(TRACE_ID, traceId);
        }
    }

    /**
     * Ensure a trace ID exists in the context.
     */
    public static String ensureTraceId() {
        String traceId = MDC.get(TRACE_ID);
        if (traceId == null) {
            traceId = UUID.randomUUID().toString().substring(0, 8);
            MDC.put(TRACE_ID, traceId);
        }
        return traceId;
    }

    @Override
    public void close() {
        MDC.remove(HOSTNAME);
        MDC.remove(EVENT_TYPE_ID);
        MDC.remove(OPERATION);
        // Keep TRACE_ID for request-scoped tracing
    }

    /**
     * Clear all MDC context. Call at the end of a request.
     */
    public static void clearAll() {
        MDC.clear();
    }
}
