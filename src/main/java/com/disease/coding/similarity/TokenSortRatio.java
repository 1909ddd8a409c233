package com.disease.coding.similarity;

/**
 * {@link IndelRatio} of both strings after sorting their whitespace tokens.
 * Tolerates word reordering ("mellitus diabetes" vs "diabetes mellitus").
 */
public class TokenSortRatio implements SimilarityScorer {

    @Override
    public double score(String query, String candidate) {
        return compute(query, candidate);
    }

    @Override
    public String getName() {
        return "TokenSortRatio";
    }

    static double compute(String s1, String s2) {
        if (s1 == null || s2 == null) {
            return 0.0;
        }
        return IndelRatio.compute(Tokens.sortedJoin(s1), Tokens.sortedJoin(s2));
    }
}
