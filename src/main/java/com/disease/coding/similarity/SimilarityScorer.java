package com.disease.coding.similarity;

/**
 * Scores how closely a query resembles a candidate name.
 * All implementations return a score between 0.0 (no similarity) and 100.0 (identical).
 *
 * <p>Threshold comparison and tie-breaking are the caller's concern, so any
 * implementation can be plugged into the resolver.</p>
 */
@FunctionalInterface
public interface SimilarityScorer {

    /**
     * Computes the similarity between a query and a candidate.
     *
     * @param query     the user-supplied text
     * @param candidate a canonical name
     * @return similarity score between 0.0 and 100.0
     */
    double score(String query, String candidate);

    /**
     * Returns the name of this scorer.
     */
    default String getName() {
        return getClass().getSimpleName();
    }
}
