package com.disease.coding.cdi;

import com.disease.coding.api.DiseaseCodingService;
import com.disease.coding.catalog.CatalogSeed;
import com.disease.coding.catalog.DiseaseCatalog;
import com.disease.coding.catalog.InMemoryDiseaseCatalog;
import com.disease.coding.metrics.MetricsService;
import com.disease.coding.metrics.MicrometerMetricsService;
import com.disease.coding.metrics.NoOpMetricsService;
import com.disease.coding.resolver.ResolverOptions;
import com.disease.coding.similarity.Scorers;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * CDI producer that wires the disease coding library from MicroProfile Config properties.
 *
 * <pre>
 * disease-coding:
 *   resolver:
 *     threshold: 70
 *     scorer: weighted-ratio
 *   catalog:
 *     seed-resource: diseases.json
 * </pre>
 *
 * <p>The catalog is produced once per application and shared by every injection point.
 * A {@link MeterRegistry} bean, when present, switches metrics to Micrometer.</p>
 */
@ApplicationScoped
public class DiseaseCodingProducer {

    private static final Logger log = LoggerFactory.getLogger(DiseaseCodingProducer.class);

    @Inject
    @ConfigProperty(name = "disease-coding.resolver.threshold", defaultValue = "70")
    double threshold;

    @Inject
    @ConfigProperty(name = "disease-coding.resolver.scorer", defaultValue = Scorers.WEIGHTED_RATIO)
    String scorerName;

    @Inject
    @ConfigProperty(name = "disease-coding.catalog.seed-resource", defaultValue = CatalogSeed.DEFAULT_RESOURCE)
    String seedResource;

    @Inject
    Instance<MeterRegistry> meterRegistry;

    @Produces
    @ApplicationScoped
    public DiseaseCatalog diseaseCatalog() {
        log.info("Producing DiseaseCatalog from seed resource '{}'", seedResource);
        return new InMemoryDiseaseCatalog(CatalogSeed.fromResource(seedResource));
    }

    @Produces
    @ApplicationScoped
    public DiseaseCodingService diseaseCodingService(DiseaseCatalog catalog) {
        log.info("Producing DiseaseCodingService: threshold={} scorer={}", threshold, scorerName);
        return DiseaseCodingService.builder()
                .catalog(catalog)
                .scorer(Scorers.byName(scorerName))
                .options(ResolverOptions.builder().threshold(threshold).build())
                .metricsService(metricsService())
                .build();
    }

    private MetricsService metricsService() {
        if (meterRegistry != null && meterRegistry.isResolvable()) {
            log.info("Micrometer registry found, recording disease coding metrics");
            return new MicrometerMetricsService(meterRegistry.get());
        }
        return new NoOpMetricsService();
    }
}
