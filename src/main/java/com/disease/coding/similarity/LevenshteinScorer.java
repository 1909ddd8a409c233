package com.disease.coding.similarity;

/**
 * Levenshtein distance-based scorer.
 * Computes {@code 100 * (1 - edit_distance / max_length)} over preprocessed strings.
 * Stricter than {@link WeightedRatioScorer} about word order.
 */
public class LevenshteinScorer implements SimilarityScorer {

    @Override
    public double score(String query, String candidate) {
        String s1 = StringPreprocessor.process(query);
        String s2 = StringPreprocessor.process(candidate);
        if (s1.isEmpty() || s2.isEmpty()) {
            return 0.0;
        }
        if (s1.equals(s2)) {
            return 100.0;
        }

        int distance = EditDistance.levenshtein(s1, s2);
        int maxLength = Math.max(s1.length(), s2.length());
        return 100.0 * (1.0 - ((double) distance / maxLength));
    }

    @Override
    public String getName() {
        return "Levenshtein";
    }
}
