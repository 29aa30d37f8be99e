package com.brush.matching.logging;

import org.slf4j.MDC;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Scoped SLF4J MDC entries. {@link #close()} restores whatever the keys held
 * before, so contexts may nest.
 *
 * <pre>
 * try (LogContext ctx = LogContext.forBatch(batchId)) {
 *     log.info("batch.completed total={}", total);
 * }
 * </pre>
 */
public class LogContext implements AutoCloseable {

    private static final AtomicLong MATCH_SEQUENCE = new AtomicLong();

    private final Map<String, String> previous = new LinkedHashMap<>();

    private LogContext() {
    }

    public static LogContext forMatch(String correlationId) {
        LogContext ctx = new LogContext();
        ctx.put("correlationId", correlationId);
        ctx.put("operation", "match");
        return ctx;
    }

    public static LogContext forBatch(String batchId) {
        LogContext ctx = new LogContext();
        ctx.put("batchId", batchId);
        ctx.put("operation", "batch");
        return ctx;
    }

    /**
     * Context for loading catalogs from the given source, usually a directory.
     */
    public static LogContext forCatalogLoad(String source) {
        LogContext ctx = new LogContext();
        ctx.put("catalogSource", source);
        ctx.put("operation", "catalog_load");
        return ctx;
    }

    public static String generateCorrelationId() {
        return UUID.randomUUID().toString();
    }

    /**
     * Process-wide sequential id for a single match, cheaper than a UUID.
     */
    public static String nextMatchId() {
        return "m-" + MATCH_SEQUENCE.incrementAndGet();
    }

    public LogContext with(String key, String value) {
        put(key, value);
        return this;
    }

    private void put(String key, String value) {
        if (!previous.containsKey(key)) {
            previous.put(key, MDC.get(key));
        }
        MDC.put(key, value);
    }

    @Override
    public void close() {
        for (Map.Entry<String, String> entry : previous.entrySet()) {
            if (entry.getValue() == null) {
                MDC.remove(entry.getKey());
            } else {
                MDC.put(entry.getKey(), entry.getValue());
            }
        }
        previous.clear();
    }
}
