package com.consent.reconciliation.logging;

import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * AutoCloseable MDC (Mapped Diagnostic Context) wrapper for structured logging.
 * Adds key-value pairs to SLF4J MDC and removes them on close.
 *
 * <pre>
 * try (LogContext ctx = LogContext.forReport(runId)) {
 *     log.info("report.completed participants={} rows={}", participants, rows);
 * }
 * </pre>
 */
public class LogContext implements AutoCloseable {

    private final List<String> keys = new ArrayList<>();

    private LogContext() {
    }

    /**
     * Creates a log context for a report run.
     */
    public static LogContext forReport(String runId) {
        LogContext ctx = new LogContext();
        ctx.put("runId", runId);
        ctx.put("operation", "report");
        return ctx;
    }

    /**
     * Creates a log context for reading one input table.
     */
    public static LogContext forImport(String runId, String table) {
        LogContext ctx = new LogContext();
        ctx.put("runId", runId);
        ctx.put("table", table);
        ctx.put("operation", "import");
        return ctx;
    }

    /**
     * Creates a log context for reconciling one participant.
     */
    public static LogContext forParticipant(String runId, String participantId) {
        LogContext ctx = new LogContext();
        ctx.put("runId", runId);
        ctx.put("participantId", participantId);
        ctx.put("operation", "reconcile");
        return ctx;
    }

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
