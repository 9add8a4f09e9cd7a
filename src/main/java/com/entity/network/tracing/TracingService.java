package com.entity.network.tracing;

import java.util.Map;

/**
 * Starts a span around each exploration, discovery and community call. Span names and
 * attribute keys come from {@link NetworkSpans}. {@link NoOpTracingService} is used when
 * no tracer is configured, so OpenTelemetry never has to be on the classpath.
 */
public interface TracingService {

    Span startSpan(String operationName);

    /**
     * Starts a span carrying the call's inputs, such as {@link NetworkSpans#START_NODE}.
     */
    Span startSpan(String operationName, Map<String, String> attributes);
}
