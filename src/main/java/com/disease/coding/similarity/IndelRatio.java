package com.disease.coding.similarity;

/**
 * Normalized InDel similarity.
 * Computes {@code 100 * (1 - indel / (|s1| + |s2|))}, where the InDel distance
 * counts insertions and deletions only, i.e. {@code |s1| + |s2| - 2 * LCS}.
 *
 * <p>Inputs are compared as given; no case folding or tokenization.</p>
 */
public class IndelRatio implements SimilarityScorer {

    @Override
    public double score(String query, String candidate) {
        return compute(query, candidate);
    }

    @Override
    public String getName() {
        return "Ratio";
    }

    static double compute(String s1, String s2) {
        if (s1 == null || s2 == null || s1.isEmpty() || s2.isEmpty()) {
            return 0.0;
        }
        if (s1.equals(s2)) {
            return 100.0;
        }
        int lcs = EditDistance.longestCommonSubsequence(s1, s2);
        return 100.0 * (2.0 * lcs) / (s1.length() + s2.length());
    }
}
