package com.entity.network.logging;

import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Puts exploration context into the SLF4J MDC for the duration of a call and removes it on close.
 *
 * <pre>
 * try (LogContext ctx = LogContext.forExploration(correlationId, "depth", startNode)) {
 *     log.debug("exploring maxDepth={}", maxDepth);
 * }
 * </pre>
 */
public class LogContext implements AutoCloseable {

    public static final String CORRELATION_ID = "correlationId";
    public static final String OPERATION = "operation";
    public static final String START_NODE = "startNode";
    public static final String QUERY_ENTITY_COUNT = "queryEntityCount";

    private final List<String> keys = new ArrayList<>();

    private LogContext() {
    }

    /**
     * Context for a single-start exploration.
     */
    public static LogContext forExploration(String correlationId, String operation, String startNode) {
        LogContext ctx = new LogContext();
        ctx.put(CORRELATION_ID, correlationId);
        ctx.put(OPERATION, operation);
        ctx.put(START_NODE, startNode);
        return ctx;
    }

    /**
     * Context for a multi-entity discovery.
     */
    public static LogContext forDiscovery(String correlationId, int queryEntityCount) {
        LogContext ctx = new LogContext();
        ctx.put(CORRELATION_ID, correlationId);
        ctx.put(OPERATION, "discover");
        ctx.put(QUERY_ENTITY_COUNT, String.valueOf(queryEntityCount));
        return ctx;
    }

    public static String generateCorrelationId() {
        return UUID.randomUUID().toString();
    }

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
