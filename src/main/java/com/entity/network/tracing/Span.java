package com.entity.network.tracing;

/**
 * A traced exploration, discovery or community call. Closing the span ends it, so a span is
 * normally held in a try-with-resources block:
 * <pre>
 * try (Span span = tracing.startSpan(NetworkSpans.name("depth"), Map.of(NetworkSpans.START_NODE, startNode))) {
 *     ExplorationResult result = service.exploreByDepth(graph, options);
 *     NetworkSpans.recordSize(span, result.size(), result.getEdges().size());
 *     NetworkSpans.recordTruncation(span, result.isTruncated());
 *     span.setStatus(Span.SpanStatus.OK);
 * }
 * </pre>
 * Attribute keys are listed in {@link NetworkSpans}.
 */
public interface Span extends AutoCloseable {

    void setAttribute(String key, String value);

    void setAttribute(String key, long value);

    void setAttribute(String key, boolean value);

    /**
     * Sets a fractional measure such as modularity.
     */
    void setAttribute(String key, double value);

    /**
     * Records a named point in time, such as a traversal hitting its node cap.
     */
    void addEvent(String name);

    void setStatus(SpanStatus status);

    void recordException(Throwable t);

    @Override
    void close();

    enum SpanStatus { OK, ERROR }
}
