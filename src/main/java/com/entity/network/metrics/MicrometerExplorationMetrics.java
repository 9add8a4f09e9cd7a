package com.entity.network.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer implementation of {@link ExplorationMetrics}.
 * Requires {@code micrometer-core} on the classpath (optional dependency).
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code network.exploration.duration}: Timer (tag: operation)</li>
 *   <li>{@code network.exploration.nodes}: DistributionSummary of result sizes</li>
 *   <li>{@code network.exploration.truncated}: Counter (tag: operation)</li>
 *   <li>{@code network.exploration.failures}: Counter (tags: operation, error)</li>
 *   <li>{@code network.discovery.bridges}: DistributionSummary of bridge counts</li>
 *   <li>{@code network.discovery.pathways}: DistributionSummary of pathway counts</li>
 * </ul>
 */
public class MicrometerExplorationMetrics implements ExplorationMetrics {

    private final MeterRegistry registry;
    private final Map<String, Timer> timers = new ConcurrentHashMap<>();
    private final Map<String, Counter> counters = new ConcurrentHashMap<>();
    private final DistributionSummary nodesSummary;
    private final DistributionSummary bridgesSummary;
    private final DistributionSummary pathwaysSummary;

    public MicrometerExplorationMetrics(MeterRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry is required");
        this.nodesSummary = DistributionSummary.builder("network.exploration.nodes")
                .description("Nodes returned per exploration")
                .register(registry);
        this.bridgesSummary = DistributionSummary.builder("network.discovery.bridges")
                .description("Bridge entities detected per discovery")
                .register(registry);
        this.pathwaysSummary = DistributionSummary.builder("network.discovery.pathways")
                .description("Pathways found per discovery")
                .register(registry);
    }

    @Override
    public void recordDuration(String operation, Duration duration) {
        timers.computeIfAbsent(operation, op ->
                Timer.builder("network.exploration.duration")
                        .description("Duration of exploration and discovery calls")
                        .tag("operation", op)
                        .register(registry))
                .record(duration);
    }

    @Override
    public void recordNodesExplored(int nodes) {
        nodesSummary.record(nodes);
    }

    @Override
    public void incrementTruncated(String operation) {
        counters.computeIfAbsent("truncated:" + operation, k ->
                Counter.builder("network.exploration.truncated")
                        .description("Results cut short by a node cap")
                        .tag("operation", operation)
                        .register(registry))
                .increment();
    }

    @Override
    public void incrementFailure(String operation, Throwable error) {
        String errorName = error.getClass().getSimpleName();
        counters.computeIfAbsent("failure:" + operation + ":" + errorName, k ->
                Counter.builder("network.exploration.failures")
                        .description("Calls that ended with an exception")
                        .tag("operation", operation)
                        .tag("error", errorName)
                        .register(registry))
                .increment();
    }

    @Override
    public void recordBridges(int bridges) {
        bridgesSummary.record(bridges);
    }

    @Override
    public void recordPathways(int pathways) {
        pathwaysSummary.record(pathways);
    }
}
