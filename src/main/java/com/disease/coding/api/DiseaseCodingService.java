package com.disease.coding.api;

import com.disease.coding.catalog.CatalogSeed;
import com.disease.coding.catalog.DiseaseCatalog;
import com.disease.coding.catalog.DiseaseNotFoundException;
import com.disease.coding.catalog.InMemoryDiseaseCatalog;
import com.disease.coding.core.model.CatalogEntry;
import com.disease.coding.core.model.CodeEntry;
import com.disease.coding.core.model.CodeEntryUpdate;
import com.disease.coding.core.model.MatchResult;
import com.disease.coding.logging.LogContext;
import com.disease.coding.metrics.MetricsService;
import com.disease.coding.metrics.NoOpMetricsService;
import com.disease.coding.resolver.DiseaseResolver;
import com.disease.coding.resolver.InvalidQueryException;
import com.disease.coding.resolver.ResolverOptions;
import com.disease.coding.similarity.Scorers;
import com.disease.coding.similarity.SimilarityScorer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Main entry point for the disease coding library.
 * Exposes the operations a presentation layer maps onto its transport:
 * resolve, list, get, update and delete.
 *
 * <h2>Example usage:</h2>
 * <pre>
 * DiseaseCodingService service = DiseaseCodingService.builder()
 *     .seed(CatalogSeed.defaults())
 *     .build();
 *
 * MatchResult result = service.resolve("asthma");
 * if (result.isFuzzy()) {
 *     System.out.println(result.suggestion());   // Did you mean 'Asthma'?
 * }
 *
 * service.update("Asthma", CodeEntryUpdate.primaryCode("CA23.0"));
 * </pre>
 *
 * <p>Errors are thrown, never converted: {@link InvalidQueryException} for unusable
 * queries and {@link DiseaseNotFoundException} for unknown names. A failed mutation
 * leaves the catalog unchanged.</p>
 */
public class DiseaseCodingService {
    private static final Logger log = LoggerFactory.getLogger(DiseaseCodingService.class);

    private final DiseaseCatalog catalog;
    private final DiseaseResolver resolver;
    private final MetricsService metricsService;

    private DiseaseCodingService(Builder builder) {
        this.catalog = builder.catalog != null
                ? builder.catalog : new InMemoryDiseaseCatalog(builder.seed);
        SimilarityScorer scorer = builder.scorer != null
                ? builder.scorer : Scorers.defaultScorer();
        this.resolver = new DiseaseResolver(catalog, scorer, builder.options);
        this.metricsService = builder.metricsService != null
                ? builder.metricsService : new NoOpMetricsService();

        log.info("DiseaseCodingService initialized: diseases={}, scorer={}, {}",
                catalog.size(), scorer.getName(), builder.options);
    }

    // ========== Resolution API ==========

    /**
     * Resolves a disease name using the configured threshold.
     *
     * @throws InvalidQueryException if the query is blank or unusable
     */
    public MatchResult resolve(String query) {
        return resolve(query, resolver.getOptions().getThreshold());
    }

    /**
     * Resolves a disease name with an explicit threshold.
     *
     * @throws InvalidQueryException if the query is blank or unusable
     */
    public MatchResult resolve(String query, double threshold) {
        long start = System.nanoTime();
        try (LogContext ctx = LogContext.forResolution(LogContext.generateCorrelationId(), query)
                .with("threshold", String.valueOf(threshold))) {
            MatchResult result;
            try {
                result = resolver.resolve(query, threshold);
            } catch (InvalidQueryException e) {
                metricsService.incrementInvalidQuery();
                log.debug("Rejected query: {}", e.getMessage());
                throw e;
            }

            metricsService.recordResolution(result.type(), Duration.ofNanos(System.nanoTime() - start));
            if (result.isFuzzy()) {
                metricsService.recordSimilarityScore(result.score());
            }
            log.info("disease.resolved matchType={} name={} score={}",
                    result.type(), result.name(), result.score());
            return result;
        }
    }

    // ========== Catalog API ==========

    /**
     * Lists every disease with its codes, in catalog order.
     */
    public List<CatalogEntry> list() {
        return catalog.entries();
    }

    /**
     * Looks up a disease by its exact canonical name.
     */
    public Optional<CodeEntry> get(String name) {
        return catalog.get(name);
    }

    /**
     * Overwrites the supplied codes of an existing disease.
     *
     * @return the entry after the update
     * @throws DiseaseNotFoundException if the name is not in the catalog
     */
    public CodeEntry update(String name, CodeEntryUpdate update) {
        try (LogContext ctx = LogContext.forMutation(LogContext.generateCorrelationId(), "update", name)) {
            try {
                CodeEntry updated = catalog.update(name, update);
                metricsService.recordCatalogMutation("update", true);
                return updated;
            } catch (DiseaseNotFoundException e) {
                metricsService.recordCatalogMutation("update", false);
                log.warn("Update rejected: {}", e.getMessage());
                throw e;
            }
        }
    }

    /**
     * Removes a disease from the catalog.
     *
     * @return the removed entry
     * @throws DiseaseNotFoundException if the name is not in the catalog
     */
    public CodeEntry delete(String name) {
        try (LogContext ctx = LogContext.forMutation(LogContext.generateCorrelationId(), "delete", name)) {
            try {
                CodeEntry removed = catalog.delete(name);
                metricsService.recordCatalogMutation("delete", true);
                return removed;
            } catch (DiseaseNotFoundException e) {
                metricsService.recordCatalogMutation("delete", false);
                log.warn("Delete rejected: {}", e.getMessage());
                throw e;
            }
        }
    }

    // ========== Accessors ==========

    public DiseaseCatalog getCatalog() {
        return catalog;
    }

    public DiseaseResolver getResolver() {
        return resolver;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private DiseaseCatalog catalog;
        private CatalogSeed seed;
        private SimilarityScorer scorer;
        private ResolverOptions options = ResolverOptions.defaults();
        private MetricsService metricsService;

        /**
         * Uses an existing catalog. Takes precedence over {@link #seed(CatalogSeed)}.
         */
        public Builder catalog(DiseaseCatalog catalog) {
            this.catalog = catalog;
            return this;
        }

        /**
         * Seeds a new in-memory catalog.
         */
        public Builder seed(CatalogSeed seed) {
            this.seed = seed;
            return this;
        }

        public Builder scorer(SimilarityScorer scorer) {
            this.scorer = scorer;
            return this;
        }

        public Builder options(ResolverOptions options) {
            this.options = options;
            return this;
        }

        public Builder threshold(double threshold) {
            this.options = ResolverOptions.builder().threshold(threshold).build();
            return this;
        }

        public Builder metricsService(MetricsService metricsService) {
            this.metricsService = metricsService;
            return this;
        }

        public DiseaseCodingService build() {
            if (catalog == null && seed == null) {
                seed = CatalogSeed.defaults();
            }
            if (options == null) {
                options = ResolverOptions.defaults();
            }
            return new DiseaseCodingService(this);
        }
    }
}
