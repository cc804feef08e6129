package com.catalog.reconciliation.logging;

import org.slf4j.MDC;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Scoped MDC entries for batch and record processing.
 * Closing the context restores whatever the keys held before it was opened,
 * so a record context opened on the batch thread leaves the batch keys intact.
 *
 * <pre>
 * try (LogContext ctx = LogContext.forRecord(batchId, resourceId, "cat")) {
 *     log.info("record.decided action={} target={}", action, targetId);
 * }
 * </pre>
 */
public final class LogContext implements AutoCloseable {

    private static final String UNKNOWN_RESOURCE = "unknown";

    // key -> value before this context set it (null when absent)
    private final Map<String, String> previous = new LinkedHashMap<>();

    private LogContext(String batchId, String workflow, String operation) {
        set("batchId", batchId);
        set("workflow", workflow);
        set("operation", operation);
    }

    public static LogContext forBatch(String batchId, String library, String workflow) {
        return new LogContext(batchId, workflow, "batch").with("library", library);
    }

    public static LogContext forRecord(String batchId, String resourceId, String workflow) {
        return new LogContext(batchId, workflow, "record")
                .with("resourceId", resourceId == null ? UNKNOWN_RESOURCE : resourceId);
    }

    public static String generateBatchId() {
        return UUID.randomUUID().toString();
    }

    public LogContext with(String key, String value) {
        set(key, value);
        return this;
    }

    private void set(String key, String value) {
        previous.putIfAbsent(key, MDC.get(key));
        if (value == null) {
            MDC.remove(key);
        } else {
            MDC.put(key, value);
        }
    }

    @Override
    public void close() {
        previous.forEach((key, old) -> {
            if (old == null) {
                MDC.remove(key);
            } else {
                MDC.put(key, old);
            }
        });
        previous.clear();
    }
}
