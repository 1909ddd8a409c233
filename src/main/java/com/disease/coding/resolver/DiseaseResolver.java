package com.disease.coding.resolver;

import com.disease.coding.catalog.DiseaseCatalog;
import com.disease.coding.core.model.CodeEntry;
import com.disease.coding.core.model.MatchResult;
import com.disease.coding.similarity.SimilarityScorer;
import com.disease.coding.validation.InputSanitizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Resolves a free-text disease name against the catalog.
 *
 * <ol>
 *   <li>Blank queries are rejected with {@link InvalidQueryException}.</li>
 *   <li>The trimmed query is looked up exactly (case-sensitive); a hit is returned
 *       without scoring.</li>
 *   <li>Otherwise every name in a snapshot of the catalog is scored. The highest score
 *       wins; equal scores go to the lexicographically smallest name.</li>
 *   <li>The winner is accepted only if its score is strictly greater than the threshold.</li>
 * </ol>
 *
 * <p>The resolver holds the catalog by reference and never caches its contents, so
 * catalog mutations are visible to the next call. Resolution itself has no side effects.</p>
 */
public class DiseaseResolver {
    private static final Logger log = LoggerFactory.getLogger(DiseaseResolver.class);

    private final DiseaseCatalog catalog;
    private final SimilarityScorer scorer;
    private final ResolverOptions options;

    public DiseaseResolver(DiseaseCatalog catalog, SimilarityScorer scorer) {
        this(catalog, scorer, ResolverOptions.defaults());
    }

    public DiseaseResolver(DiseaseCatalog catalog, SimilarityScorer scorer, ResolverOptions options) {
        this.catalog = Objects.requireNonNull(catalog, "catalog is required");
        this.scorer = Objects.requireNonNull(scorer, "scorer is required");
        this.options = Objects.requireNonNull(options, "options is required");
    }

    /**
     * Resolves a query using the configured threshold.
     */
    public MatchResult resolve(String query) {
        return resolve(query, options.getThreshold());
    }

    /**
     * Resolves a query with an explicit threshold.
     *
     * @param query     the disease name as typed by the caller
     * @param threshold fuzzy scores must be strictly greater than this, in [0, 100]
     * @throws InvalidQueryException if the query is blank or unusable
     */
    public MatchResult resolve(String query, double threshold) {
        String problem = InputSanitizer.describeQueryProblem(query);
        if (problem != null) {
            throw new InvalidQueryException(problem);
        }
        ResolverOptions.validateThreshold(threshold);

        String trimmed = query.trim();

        Optional<CodeEntry> exact = catalog.get(trimmed);
        if (exact.isPresent()) {
            log.debug("Exact match for '{}'", trimmed);
            return MatchResult.exact(trimmed, exact.get());
        }

        Candidate best = findBestCandidate(trimmed);
        if (best == null) {
            log.debug("No candidates to score for '{}'", trimmed);
            return MatchResult.notFound();
        }

        log.debug("Best fuzzy candidate for '{}': '{}' score={} threshold={}",
                trimmed, best.name(), best.score(), threshold);

        if (best.score() <= threshold) {
            return MatchResult.notFound();
        }

        Optional<CodeEntry> entry = catalog.get(best.name());
        if (entry.isEmpty()) {
            log.warn("Fuzzy candidate '{}' was removed before it could be read", best.name());
            return MatchResult.notFound();
        }
        return MatchResult.fuzzy(best.name(), entry.get(), best.score());
    }

    public SimilarityScorer getScorer() {
        return scorer;
    }

    public ResolverOptions getOptions() {
        return options;
    }

    /**
     * Scores every catalog name and keeps the best; ties go to the smaller name.
     */
    private Candidate findBestCandidate(String query) {
        List<String> names = catalog.names();
        Candidate best = null;
        for (String name : names) {
            double score = scorer.score(query, name);
            if (best == null
                    || score > best.score()
                    || (score == best.score() && name.compareTo(best.name()) < 0)) {
                best = new Candidate(name, score);
            }
        }
        return best;
    }

    private record Candidate(String name, double score) {}
}
