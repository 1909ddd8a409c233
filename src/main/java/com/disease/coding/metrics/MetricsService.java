package com.disease.coding.metrics;

import com.disease.coding.core.model.MatchType;

import java.time.Duration;

/**
 * Interface for recording disease coding metrics.
 * Implementations can integrate with Micrometer, Prometheus, or other metrics systems.
 * The default {@link NoOpMetricsService} does nothing, so the library works
 * without any metrics dependencies on the classpath.
 */
public interface MetricsService {

    void recordResolution(MatchType matchType, Duration duration);

    void recordSimilarityScore(double score);

    void incrementInvalidQuery();

    /**
     * Counts a catalog mutation.
     *
     * @param operation {@code update} or {@code delete}
     * @param succeeded false when the disease was not found
     */
    void recordCatalogMutation(String operation, boolean succeeded);
}
