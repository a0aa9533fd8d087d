package com.vectorstore.dedup.logging;

import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * AutoCloseable MDC (Mapped Diagnostic Context) scope for structured logging.
 * Entries added through this context are removed on close.
 *
 * <pre>
 * try (LogContext ctx = LogContext.forAnalysis(correlationId, "docs")) {
 *     log.info("dedup.analysis.completed groups={}", groups.size());
 * }
 * </pre>
 */
public class LogContext implements AutoCloseable {

    private final List<String> keys = new ArrayList<>();

    private LogContext() {
    }

    public static LogContext forAnalysis(String correlationId, String namespace) {
        LogContext ctx = new LogContext();
        ctx.put("correlationId", correlationId);
        ctx.put("namespace", namespace);
        ctx.put("operation", "analyze");
        return ctx;
    }

    public static LogContext forDeletion(String correlationId, String namespace) {
        LogContext ctx = new LogContext();
        ctx.put("correlationId", correlationId);
        ctx.put("namespace", namespace);
        ctx.put("operation", "delete");
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
