package com.document.verification.logging;

import org.slf4j.MDC;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Scoped SLF4J MDC entries for structured logging.
 * Each entry shadows whatever the thread held under the same key; {@link #close()} puts the
 * shadowed value back, so contexts can nest.
 *
 * <pre>
 * try (LogContext ctx = LogContext.forVerification(correlationId)) {
 *     log.info("verification.completed totalFields={} averageConfidence={}", total, average);
 * }
 * </pre>
 *
 * <p>Work handed to a pool keeps the caller's entries through {@link #capture()} on the
 * submitting thread and {@link #adopt(Map)} on the worker.</p>
 */
public final class LogContext implements AutoCloseable {

    // key -> value held before this context, null when the key was unset
    private final Map<String, String> shadowed = new LinkedHashMap<>();

    private LogContext() {
    }

    public static LogContext forVerification(String correlationId) {
        return new LogContext()
                .with("correlationId", correlationId)
                .with("operation", "verify");
    }

    public static LogContext forBatch(String batchId, int size) {
        return new LogContext()
                .with("batchId", batchId)
                .with("batchSize", String.valueOf(size))
                .with("operation", "batch");
    }

    /**
     * Installs entries captured on another thread.
     *
     * @param captured result of {@link #capture()}; null or empty installs nothing
     */
    public static LogContext adopt(Map<String, String> captured) {
        LogContext ctx = new LogContext();
        if (captured != null) {
            captured.forEach(ctx::with);
        }
        return ctx;
    }

    /**
     * Copies the current thread's MDC entries. Never null.
     */
    public static Map<String, String> capture() {
        Map<String, String> current = MDC.getCopyOfContextMap();
        return current == null ? Map.of() : current;
    }

    public static String generateCorrelationId() {
        return UUID.randomUUID().toString();
    }

    public LogContext with(String key, String value) {
        if (!shadowed.containsKey(key)) {
            shadowed.put(key, MDC.get(key));
        }
        MDC.put(key, value);
        return this;
    }

    @Override
    public void close() {
        shadowed.forEach((key, previous) -> {
            if (previous == null) {
                MDC.remove(key);
            } else {
                MDC.put(key, previous);
            }
        });
        shadowed.clear();
    }
}
