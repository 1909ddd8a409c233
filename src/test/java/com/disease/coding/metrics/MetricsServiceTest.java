package com.disease.coding.metrics;

import com.disease.coding.core.model.MatchType;
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
                noOp.recordResolution(MatchType.EXACT, Duration.ofMillis(5));
                noOp.recordSimilarityScore(83.3);
                noOp.incrementInvalidQuery();
                noOp.recordCatalogMutation("update", true);
            });
        }
    }

    @Nested
    @DisplayName("MicrometerMetricsService")
    class MicrometerTests {

        private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
        private final MicrometerMetricsService metrics = new MicrometerMetricsService(registry);

        @Test
        @DisplayName("Should record resolution duration per match type")
        void recordResolution() {
            metrics.recordResolution(MatchType.FUZZY, Duration.ofMillis(150));
            metrics.recordResolution(MatchType.FUZZY, Duration.ofMillis(250));
            metrics.recordResolution(MatchType.NOT_FOUND, Duration.ofMillis(10));

            Timer fuzzy = registry.find("disease.resolution.duration").tag("matchType", "FUZZY").timer();
            assertNotNull(fuzzy);
            assertEquals(2, fuzzy.count());
            assertEquals(400, fuzzy.totalTime(TimeUnit.MILLISECONDS), 1.0);

            Timer notFound = registry.find("disease.resolution.duration").tag("matchType", "NOT_FOUND").timer();
            assertNotNull(notFound);
            assertEquals(1, notFound.count());
        }

        @Test
        @DisplayName("Should record similarity scores as a distribution")
        void recordSimilarityScore() {
            metrics.recordSimilarityScore(80.0);
            metrics.recordSimilarityScore(90.0);

            DistributionSummary summary = registry.find("disease.similarity.score").summary();
            assertNotNull(summary);
            assertEquals(2, summary.count());
            assertEquals(85.0, summary.mean(), 0.001);
        }

        @Test
        @DisplayName("Should count invalid queries")
        void incrementInvalidQuery() {
            metrics.incrementInvalidQuery();
            metrics.incrementInvalidQuery();

            Counter counter = registry.find("disease.query.invalid").counter();
            assertNotNull(counter);
            assertEquals(2.0, counter.count());
        }

        @Test
        @DisplayName("Should count mutations by operation and outcome")
        void recordCatalogMutation() {
            metrics.recordCatalogMutation("update", true);
            metrics.recordCatalogMutation("update", true);
            metrics.recordCatalogMutation("delete", false);

            Counter updates = registry.find("disease.catalog.mutation")
                    .tag("operation", "update").tag("outcome", "success").counter();
            Counter missingDeletes = registry.find("disease.catalog.mutation")
                    .tag("operation", "delete").tag("outcome", "not_found").counter();

            assertNotNull(updates);
            assertEquals(2.0, updates.count());
            assertNotNull(missingDeletes);
            assertEquals(1.0, missingDeletes.count());
        }
    }
}
