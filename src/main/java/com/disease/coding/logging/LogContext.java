package com.disease.coding.logging;

import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * AutoCloseable MDC (Mapped Diagnostic Context) wrapper for structured logging.
 * Adds key-value pairs to SLF4J MDC and removes them on close.
 *
 * <pre>
 * try (LogContext ctx = LogContext.forResolution(correlationId, query)) {
 *     log.info("disease.resolved name={} matchType={}", name, matchType);
 * }
 * </pre>
 */
public class LogContext implements AutoCloseable {

    private final List<String> keys = new ArrayList<>();

    private LogContext() {
    }

    /**
     * Creates a log context for a resolution.
     */
    public static LogContext forResolution(String correlationId, String query) {
        LogContext ctx = new LogContext();
        ctx.put("correlationId", correlationId);
        ctx.put("query", query);
        ctx.put("operation", "resolve");
        return ctx;
    }

    /**
     * Creates a log context for a catalog update or delete.
     */
    public static LogContext forMutation(String correlationId, String operation, String diseaseName) {
        LogContext ctx = new LogContext();
        ctx.put("correlationId", correlationId);
        ctx.put("diseaseName", diseaseName);
        ctx.put("operation", operation);
        return ctx;
    }

    public static String generateCorrelationId() {
        return UUID.randomUUID().toString();
    }

    /**
     * Adds an additional key-value pair to this log context.
     */
    public LogContext with(String key, String value) {
        put(key, value);
        return this;
    }

    private void put(String key, String value) {
        keys.add(key);
        MDC.put(key, value);
    }

    @Override
    public void close() {
        for (String key : keys) {
            MDC.remove(key);
        }
        keys.clear();
    }
}
