package com.identity.matching.logging;

import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * AutoCloseable MDC wrapper for structured logging.
 * Adds key-value pairs to SLF4J MDC and removes them on close.
 *
 * <pre>
 * try (LogContext ctx = LogContext.forEnrollment(correlationId, identityId)) {
 *     log.info("enrollment.completed identityId={} accepted={}", identityId, accepted);
 * }
 * </pre>
 */
public class LogContext implements AutoCloseable {

    private final List<String> keys = new ArrayList<>();

    private LogContext() {
    }

    public static LogContext forEnrollment(String correlationId, String identityId) {
        LogContext ctx = new LogContext();
        ctx.put("correlationId", correlationId);
        ctx.put("identityId", identityId);
        ctx.put("operation", "enroll");
        return ctx;
    }

    public static LogContext forAuthentication(String correlationId) {
        LogContext ctx = new LogContext();
        ctx.put("correlationId", correlationId);
        ctx.put("operation", "authenticate");
        return ctx;
    }

    /**
     * @param operation {@code export}, {@code import} or {@code remove}
     */
    public static LogContext forTransfer(String correlationId, String operation, String identityId) {
        LogContext ctx = new LogContext();
        ctx.put("correlationId", correlationId);
        ctx.put("identityId", identityId);
        ctx.put("operation", operation);
        return ctx;
    }

    public static LogContext forImport(String importId) {
        LogContext ctx = new LogContext();
        ctx.put("importId", importId);
        ctx.put("operation", "import-directory");
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
        if (value == null) {
            return;
        }
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
