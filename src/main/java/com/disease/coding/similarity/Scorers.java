package com.disease.coding.similarity;

import java.util.Locale;

/**
 * Looks up a scorer by its configuration name.
 */
public final class Scorers {

    public static final String WEIGHTED_RATIO = "weighted-ratio";
    public static final String LEVENSHTEIN = "levenshtein";

    private Scorers() {
        // utility class
    }

    public static SimilarityScorer defaultScorer() {
        return new WeightedRatioScorer();
    }

    /**
     * Returns the scorer registered under {@code name}.
     *
     * @throws IllegalArgumentException if the name is unknown
     */
    public static SimilarityScorer byName(String name) {
        if (name == null || name.isBlank()) {
            return defaultScorer();
        }
        return switch (name.trim().toLowerCase(Locale.ROOT)) {
            case WEIGHTED_RATIO -> new WeightedRatioScorer();
            case LEVENSHTEIN -> new LevenshteinScorer();
            default -> throw new IllegalArgumentException("Unknown scorer: " + name);
        };
    }
}
