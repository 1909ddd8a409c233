package com.disease.coding.metrics;

import com.disease.coding.core.model.MatchType;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code disease.resolution.duration} Timer (tag: matchType)</li>
 *   <li>{@code disease.similarity.score} DistributionSummary of accepted fuzzy scores</li>
 *   <li>{@code disease.query.invalid} Counter</li>
 *   <li>{@code disease.catalog.mutation} Counter (tags: operation, outcome)</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Map<MatchType, Timer> resolutionTimers = new ConcurrentHashMap<>();
    private final Map<String, Counter> mutationCounters = new ConcurrentHashMap<>();
    private final DistributionSummary similarityScoreSummary;
    private final Counter invalidQueryCounter;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
        this.similarityScoreSummary = DistributionSummary.builder("disease.similarity.score")
                .description("Distribution of accepted fuzzy match scores")
                .register(registry);
        this.invalidQueryCounter = Counter.builder("disease.query.invalid")
                .description("Number of rejected resolution queries")
                .register(registry);
    }

    @Override
    public void recordResolution(MatchType matchType, Duration duration) {
        Timer timer = resolutionTimers.computeIfAbsent(matchType, type ->
                Timer.builder("disease.resolution.duration")
                        .description("Duration of disease name resolution")
                        .tag("matchType", type.name())
                        .register(registry));
        timer.record(duration);
    }

    @Override
    public void recordSimilarityScore(double score) {
        similarityScoreSummary.record(score);
    }

    @Override
    public void incrementInvalidQuery() {
        invalidQueryCounter.increment();
    }

    @Override
    public void recordCatalogMutation(String operation, boolean succeeded) {
        String outcome = succeeded ? "success" : "not_found";
        Counter counter = mutationCounters.computeIfAbsent(operation + ":" + outcome, k ->
                Counter.builder("disease.catalog.mutation")
                        .description("Number of catalog updates and deletions")
                        .tag("operation", operation)
                        .tag("outcome", outcome)
                        .register(registry));
        counter.increment();
    }
}
