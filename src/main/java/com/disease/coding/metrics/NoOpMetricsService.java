package com.disease.coding.metrics;

import com.disease.coding.core.model.MatchType;

import java.time.Duration;

/**
 * No-op implementation of {@link MetricsService}.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordResolution(MatchType matchType, Duration duration) {
    }

    @Override
    public void recordSimilarityScore(double score) {
    }

    @Override
    public void incrementInvalidQuery() {
    }

    @Override
    public void recordCatalogMutation(String operation, boolean succeeded) {
    }
}
