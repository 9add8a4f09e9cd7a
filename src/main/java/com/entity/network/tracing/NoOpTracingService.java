package com.entity.network.tracing;

import java.util.Map;

/**
 * Tracing that records nothing. Every call returns the same inert span.
 */
public class NoOpTracingService implements TracingService {

    private static final Span INERT = new InertSpan();

    @Override
    public Span startSpan(String operationName) {
        return INERT;
    }

    @Override
    public Span startSpan(String operationName, Map<String, String> attributes) {
        return INERT;
    }

    private static final class InertSpan implements Span {
        @Override
        public void setAttribute(String key, String value) {
        }

        @Override
        public void setAttribute(String key, long value) {
        }

        @Override
        public void setAttribute(String key, boolean value) {
        }

        @Override
        public void setAttribute(String key, double value) {
        }

        @Override
        public void addEvent(String name) {
        }

        @Override
        public void setStatus(SpanStatus status) {
        }

        @Override
        public void recordException(Throwable t) {
        }

        @Override
        public void close() {
        }
    }
}
