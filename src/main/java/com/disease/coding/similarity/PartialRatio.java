package com.disease.coding.similarity;

/**
 * Best {@link IndelRatio} of the shorter string against any same-length window of
 * the longer one. Windows clipped at either end of the longer string are included,
 * so a query that overlaps the start or end of a name still scores.
 */
public class PartialRatio implements SimilarityScorer {

    @Override
    public double score(String query, String candidate) {
        return compute(query, candidate);
    }

    @Override
    public String getName() {
        return "PartialRatio";
    }

    static double compute(String s1, String s2) {
        if (s1 == null || s2 == null || s1.isEmpty() || s2.isEmpty()) {
            return 0.0;
        }
        if (s1.length() == s2.length()) {
            // Equal lengths: neither side is the natural window, so try both
            return Math.max(bestWindow(s1, s2), bestWindow(s2, s1));
        }
        return s1.length() < s2.length() ? bestWindow(s1, s2) : bestWindow(s2, s1);
    }

    private static double bestWindow(String shorter, String longer) {
        int m = shorter.length();
        int n = longer.length();
        double best = 0.0;
        for (int start = -(m - 1); start < n; start++) {
            int from = Math.max(0, start);
            int to = Math.min(n, start + m);
            double ratio = IndelRatio.compute(shorter, longer.substring(from, to));
            if (ratio > best) {
                best = ratio;
                if (best == 100.0) {
                    break;
                }
            }
        }
        return best;
    }
}
