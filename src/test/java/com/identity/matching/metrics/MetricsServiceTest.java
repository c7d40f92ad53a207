package com.identity.matching.metrics;

import com.identity.matching.core.model.MatchDecision;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("MetricsService Tests")
class MetricsServiceTest {

    @Nested
    @DisplayName("NoOpMetricsService")
    class NoOpTests {

        @Test
        @DisplayName("All methods should be callable without error")
        void allMethodsCallableWithoutError() {
            NoOpMetricsService noOp = new NoOpMetricsService();

            assertDoesNotThrow(() -> {
                noOp.recordAuthenticationDuration(MatchDecision.ACCEPTED, Duration.ofMillis(3));
                noOp.recordMatchScore(0.42);
                noOp.incrementEnrolled();
                noOp.incrementEnrollmentRejected();
                noOp.incrementSamplesRejected("INVALID_VALUE", 2);
                noOp.incrementMatchRecorded();
                noOp.incrementTransfer("export");
                noOp.recordRegistrySize(10);
                noOp.recordCacheHit();
                noOp.recordCacheMiss();
            });
        }
    }

    @Nested
    @DisplayName("MicrometerMetricsService")
    class MicrometerTests {

        private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
        private final MicrometerMetricsService metrics = new MicrometerMetricsService(registry);

        @Test
        @DisplayName("Should record authentication duration per decision")
        void authenticationTimer() {
            metrics.recordAuthenticationDuration(MatchDecision.ACCEPTED, Duration.ofMillis(20));
            metrics.recordAuthenticationDuration(MatchDecision.ACCEPTED, Duration.ofMillis(40));
            metrics.recordAuthenticationDuration(MatchDecision.REJECTED, Duration.ofMillis(10));

            Timer accepted = registry.find("identity.authentication.duration").tag("decision", "ACCEPTED").timer();
            assertNotNull(accepted);
            assertEquals(2, accepted.count());
            assertEquals(60, accepted.totalTime(TimeUnit.MILLISECONDS), 0.001);
            assertEquals(1, registry.find("identity.authentication.duration")
                    .tag("decision", "REJECTED").timer().count());
        }

        @Test
        @DisplayName("Should skip infinite scores")
        void matchScore() {
            metrics.recordMatchScore(0.3);
            metrics.recordMatchScore(Double.POSITIVE_INFINITY);

            DistributionSummary summary = registry.find("identity.match.score").summary();
            assertNotNull(summary);
            assertEquals(1, summary.count());
            assertEquals(0.3, summary.totalAmount(), 1e-9);
        }

        @Test
        @DisplayName("Should count rejected samples by reason")
        void samplesRejected() {
            metrics.incrementSamplesRejected("DIMENSION_MISMATCH", 2);
            metrics.incrementSamplesRejected("DIMENSION_MISMATCH", 1);
            metrics.incrementSamplesRejected("INVALID_VALUE", 0);

            Counter counter = registry.find("identity.samples.rejected").tag("reason", "DIMENSION_MISMATCH").counter();
            assertNotNull(counter);
            assertEquals(3.0, counter.count());
            assertNull(registry.find("identity.samples.rejected").tag("reason", "INVALID_VALUE").counter());
        }

        @Test
        @DisplayName("Should count lifecycle events")
        void counters() {
            metrics.incrementEnrolled();
            metrics.incrementEnrolled();
            metrics.incrementEnrollmentRejected();
            metrics.incrementMatchRecorded();
            metrics.incrementTransfer("import");
            metrics.recordCacheHit();
            metrics.recordCacheMiss();
            metrics.recordCacheMiss();

            assertEquals(2.0, registry.find("identity.enrolled").counter().count());
            assertEquals(1.0, registry.find("identity.enrollment.rejected").counter().count());
            assertEquals(1.0, registry.find("identity.match.recorded").counter().count());
            assertEquals(1.0, registry.find("identity.transfer").tag("direction", "import").counter().count());
            assertEquals(1.0, registry.find("identity.cache.hit").counter().count());
            assertEquals(2.0, registry.find("identity.cache.miss").counter().count());
        }

        @Test
        @DisplayName("Should record registry size")
        void registrySize() {
            metrics.recordRegistrySize(12);

            assertEquals(12.0, registry.find("identity.registry.size").summary().max());
        }
    }
}
