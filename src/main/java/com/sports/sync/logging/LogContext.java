package com.sports.sync.logging;

import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * AutoCloseable MDC wrapper for structured synchronization logs.
 * Keys added through a context are removed again when it is closed.
 *
 * <pre>
 * try (LogContext ctx = LogContext.forSynchronization(correlationId, "PLAYER")) {
 *     try (LogContext pair = LogContext.forPair("opta", "statsbomb", 1)) {
 *         log.info("sync.pair matched={}", matched);
 *     }
 * }
 * </pre>
 */
public class LogContext implements AutoCloseable {

    private final List<String> keys = new ArrayList<>();

    private LogContext() {
    }

    /**
     * Creates a log context for one synchronize() call.
     */
    public static LogContext forSynchronization(String correlationId, String entityType) {
        LogContext ctx = new LogContext();
        ctx.put("correlationId", correlationId);
        ctx.put("entityType", entityType);
        ctx.put("operation", "synchronize");
        return ctx;
    }

    /**
     * Creates a log context for one pairwise strategy run.
     */
    public static LogContext forPair(String leftProvider, String rightProvider, int pass) {
        LogContext ctx = new LogContext();
        ctx.put("pair", leftProvider + "|" + rightProvider);
        ctx.put("pass", String.valueOf(pass));
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
