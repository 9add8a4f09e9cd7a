package com.entity.network.tracing;

/**
 * Span names, attribute keys and events written by traced engine calls.
 * Every span is named {@code network.<operation>}, for example {@code network.depth}
 * or {@code network.progressive.random_walk}.
 */
public final class NetworkSpans {

    public static final String PREFIX = "network.";

    // ========== Attributes set when the span starts ==========

    public static final String START_NODE = "network.start_node";
    public static final String CENTER_NODE = "network.center_node";
    public static final String QUERY_ENTITIES = "network.query_entities";

    // ========== Attributes set from the result ==========

    public static final String NODES = "network.nodes";
    public static final String EDGES = "network.edges";
    public static final String MAX_DEPTH = "network.max_depth";
    public static final String TRUNCATED = "network.truncated";
    public static final String DIRECT_CONNECTIONS = "network.direct_connections";
    public static final String BRIDGES = "network.bridges";
    public static final String PATHWAYS = "network.pathways";
    public static final String COMMUNITIES = "network.communities";
    public static final String COMMUNITY_BRIDGES = "network.community_bridges";
    public static final String MODULARITY = "network.modularity";

    // ========== Events ==========

    /** A node or pathway cap stopped the call before the search space was exhausted. */
    public static final String TRUNCATED_EVENT = "truncated";

    private NetworkSpans() {
    }

    public static String name(String operation) {
        return PREFIX + operation;
    }

    /**
     * Records the size of the graph or result a call produced.
     */
    public static void recordSize(Span span, int nodes, int edges) {
        span.setAttribute(NODES, nodes);
        span.setAttribute(EDGES, edges);
    }

    /**
     * Records the truncation flag, and a {@link #TRUNCATED_EVENT} when it is set.
     */
    public static void recordTruncation(Span span, boolean truncated) {
        span.setAttribute(TRUNCATED, truncated);
        if (truncated) {
            span.addEvent(TRUNCATED_EVENT);
        }
    }

    public static void recordFailure(Span span, Throwable failure) {
        span.recordException(failure);
        span.setStatus(Span.SpanStatus.ERROR);
    }
}
