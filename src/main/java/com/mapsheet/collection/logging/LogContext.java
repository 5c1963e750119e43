package com.mapsheet.collection.logging;

import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * AutoCloseable MDC wrapper for structured logging.
 * Adds key-value pairs to the SLF4J MDC and removes them on close.
 *
 * <pre>
 * try (LogContext ctx = LogContext.forEvent(eventId, fileName)) {
 *     log.info("file.resolved workUnit={} category={}", id, category);
 * }
 * </pre>
 */
public class LogContext implements AutoCloseable {

    private final List<String> keys = new ArrayList<>();

    private LogContext() {
    }

    /**
     * Creates a log context for handling one file event.
     */
    public static LogContext forEvent(String eventId, String fileName) {
        LogContext ctx = new LogContext();
        ctx.put("eventId", eventId);
        ctx.put("fileName", fileName);
        ctx.put("operation", "event");
        return ctx;
    }

    /**
     * Creates a log context for a deadline backfill of one (work unit, category) pair.
     */
    public static LogContext forBackfill(String workUnit, String category) {
        LogContext ctx = new LogContext();
        ctx.put("workUnit", workUnit);
        ctx.put("category", category);
        ctx.put("operation", "backfill");
        return ctx;
    }

    /**
     * Creates a log context for a monitoring period.
     */
    public static LogContext forPeriod(String periodDate) {
        LogContext ctx = new LogContext();
        ctx.put("periodDate", periodDate);
        ctx.put("operation", "monitor");
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
