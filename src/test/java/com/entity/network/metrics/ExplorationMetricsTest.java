package com.entity.network.metrics;

import com.entity.network.exploration.UnknownStartNodeException;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ExplorationMetrics Tests")
class ExplorationMetricsTest {

    @Nested
    @DisplayName("NoOpExplorationMetrics")
    class NoOpTests {

        @Test
        @DisplayName("All methods should be callable without error")
        void allMethodsCallableWithoutError() {
            NoOpExplorationMetrics noOp = new NoOpExplorationMetrics();

            assertDoesNotThrow(() -> {
                noOp.recordDuration("depth", Duration.ofMillis(10));
                noOp.recordNodesExplored(25);
                noOp.incrementTruncated("depth");
                noOp.incrementFailure("discover", new IllegalStateException("boom"));
                noOp.recordBridges(3);
                noOp.recordPathways(1);
            });
        }
    }

    @Nested
    @DisplayName("MicrometerExplorationMetrics")
    class MicrometerTests {

        private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
        private final MicrometerExplorationMetrics metrics = new MicrometerExplorationMetrics(registry);

        @Test
        @DisplayName("Should record durations as a timer per operation")
        void recordDuration() {
            metrics.recordDuration("depth", Duration.ofMillis(150));
            metrics.recordDuration("depth", Duration.ofMillis(250));
            metrics.recordDuration("discover", Duration.ofMillis(50));

            Timer depth = registry.find("network.exploration.duration").tag("operation", "depth").timer();
            Timer discover = registry.find("network.exploration.duration").tag("operation", "discover").timer();

            assertNotNull(depth);
            assertEquals(2, depth.count());
            assertNotNull(discover);
            assertEquals(1, discover.count());
        }

        @Test
        @DisplayName("Should record result sizes as a distribution summary")
        void recordNodesExplored() {
            metrics.recordNodesExplored(10);
            metrics.recordNodesExplored(30);

            DistributionSummary summary = registry.find("network.exploration.nodes").summary();

            assertNotNull(summary);
            assertEquals(2, summary.count());
            assertEquals(40.0, summary.totalAmount());
        }

        @Test
        @DisplayName("Should count truncations per operation")
        void incrementTruncated() {
            metrics.incrementTruncated("depth");
            metrics.incrementTruncated("depth");
            metrics.incrementTruncated("progressive.breadth");

            Counter depth = registry.find("network.exploration.truncated").tag("operation", "depth").counter();
            Counter progressive = registry.find("network.exploration.truncated")
                    .tag("operation", "progressive.breadth").counter();

            assertNotNull(depth);
            assertEquals(2.0, depth.count());
            assertNotNull(progressive);
            assertEquals(1.0, progressive.count());
        }

        @Test
        @DisplayName("Should tag failures with the exception type")
        void incrementFailure() {
            metrics.incrementFailure("depth", new UnknownStartNodeException("42"));
            metrics.incrementFailure("depth", new IllegalArgumentException("bad"));

            Counter unknown = registry.find("network.exploration.failures")
                    .tag("operation", "depth")
                    .tag("error", "UnknownStartNodeException")
                    .counter();
            Counter illegal = registry.find("network.exploration.failures")
                    .tag("error", "IllegalArgumentException")
                    .counter();

            assertNotNull(unknown);
            assertEquals(1.0, unknown.count());
            assertNotNull(illegal);
            assertEquals(1.0, illegal.count());
        }

        @Test
        @DisplayName("Should record bridge and pathway counts")
        void recordDiscoveryCounts() {
            metrics.recordBridges(4);
            metrics.recordPathways(2);
            metrics.recordPathways(0);

            assertEquals(4.0, registry.find("network.discovery.bridges").summary().totalAmount());
            assertEquals(2, registry.find("network.discovery.pathways").summary().count());
        }
    }
}
