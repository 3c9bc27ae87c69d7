package com.master.sync.logging;

import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * AutoCloseable MDC (Mapped Diagnostic Context) wrapper for structured logging.
 * Adds key-value pairs to SLF4J MDC and automatically removes them on close.
 *
 * <p>Usage with try-with-resources:</p>
 * <pre>
 * try (LogContext ctx = LogContext.forReconciliation(runId, "organization")) {
 *     log.info("reconcile.completed changes={}", changes.size());
 * } // MDC entries are automatically cleared
 * </pre>
 */
public class LogContext implements AutoCloseable {

    private final List<String> keys = new ArrayList<>();

    private LogContext() {
    }

    /**
     * Creates a log context for a change-set reconciliation.
     */
    public static LogContext forReconciliation(String runId, String entityType) {
        LogContext ctx = new LogContext();
        ctx.put("runId", runId);
        ctx.put("entityType", entityType);
        ctx.put("operation", "reconcile");
        return ctx;
    }

    /**
     * Creates a log context for building the organization hierarchy.
     */
    public static LogContext forHierarchy(String runId) {
        LogContext ctx = new LogContext();
        ctx.put("runId", runId);
        ctx.put("operation", "hierarchy");
        return ctx;
    }

    /**
     * Creates a log context for exporting a change set.
     */
    public static LogContext forExport(String runId, String baseName) {
        LogContext ctx = new LogContext();
        ctx.put("runId", runId);
        ctx.put("baseName", baseName);
        ctx.put("operation", "export");
        return ctx;
    }

    /**
     * Generates a unique run ID.
     */
    public static String generateRunId() {
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
