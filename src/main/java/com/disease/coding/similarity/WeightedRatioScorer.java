package com.disease.coding.similarity;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.SortedSet;

/**
 * Default scorer: takes the best of several ratios, discounting the looser ones.
 *
 * <p>Both strings are first run through {@link StringPreprocessor}. With
 * {@code lenRatio = longer / shorter}:</p>
 * <ul>
 *   <li>{@code lenRatio < 1.5}: {@code max(ratio, max(tokenSort, tokenSet) * 0.95)}</li>
 *   <li>otherwise: {@code max(ratio, partial * s, partialToken * 0.95 * s)} with
 *       {@code s = 0.9}, or {@code 0.6} once {@code lenRatio >= 8}</li>
 * </ul>
 */
public class WeightedRatioScorer implements SimilarityScorer {
    private static final Logger log = LoggerFactory.getLogger(WeightedRatioScorer.class);

    static final double UNBASE_SCALE = 0.95;
    static final double PARTIAL_SCALE = 0.9;
    static final double LONG_PARTIAL_SCALE = 0.6;
    static final double PARTIAL_LENGTH_RATIO = 1.5;
    static final double LONG_LENGTH_RATIO = 8.0;

    @Override
    public double score(String query, String candidate) {
        String p1 = StringPreprocessor.process(query);
        String p2 = StringPreprocessor.process(candidate);
        if (p1.isEmpty() || p2.isEmpty()) {
            return 0.0;
        }
        if (p1.equals(p2)) {
            return 100.0;
        }

        double ratio = IndelRatio.compute(p1, p2);
        double lenRatio = lengthRatio(p1, p2);

        double result;
        if (lenRatio < PARTIAL_LENGTH_RATIO) {
            double tokenRatio = Math.max(TokenSortRatio.compute(p1, p2), TokenSetRatio.compute(p1, p2));
            result = Math.max(ratio, tokenRatio * UNBASE_SCALE);
        } else {
            double partialScale = lenRatio < LONG_LENGTH_RATIO ? PARTIAL_SCALE : LONG_PARTIAL_SCALE;
            result = Math.max(ratio, PartialRatio.compute(p1, p2) * partialScale);
            result = Math.max(result, partialTokenRatio(p1, p2) * UNBASE_SCALE * partialScale);
        }

        log.debug("Weighted ratio for '{}' vs '{}': ratio={}, lenRatio={}, weighted={}",
                p1, p2, ratio, lenRatio, result);
        return result;
    }

    @Override
    public String getName() {
        return "WeightedRatio";
    }

    /**
     * Computes every component score for a pair, for diagnostics.
     */
    public ScoreBreakdown breakdown(String query, String candidate) {
        String p1 = StringPreprocessor.process(query);
        String p2 = StringPreprocessor.process(candidate);
        return new ScoreBreakdown(
                IndelRatio.compute(p1, p2),
                TokenSortRatio.compute(p1, p2),
                TokenSetRatio.compute(p1, p2),
                PartialRatio.compute(p1, p2),
                partialTokenRatio(p1, p2),
                score(query, candidate)
        );
    }

    /**
     * 100 when the token sets share any token, otherwise the partial ratio of the
     * sorted token strings.
     */
    static double partialTokenRatio(String s1, String s2) {
        SortedSet<String> tokens1 = Tokens.sortedSet(s1);
        SortedSet<String> tokens2 = Tokens.sortedSet(s2);
        if (tokens1.isEmpty() || tokens2.isEmpty()) {
            return 0.0;
        }
        for (String token : tokens1) {
            if (tokens2.contains(token)) {
                return 100.0;
            }
        }
        return PartialRatio.compute(Tokens.sortedJoin(s1), Tokens.sortedJoin(s2));
    }

    private static double lengthRatio(String s1, String s2) {
        int shorter = Math.min(s1.length(), s2.length());
        int longer = Math.max(s1.length(), s2.length());
        return (double) longer / shorter;
    }

    /**
     * Component scores behind a weighted ratio.
     */
    public record ScoreBreakdown(
            double ratio,
            double tokenSortRatio,
            double tokenSetRatio,
            double partialRatio,
            double partialTokenRatio,
            double weightedRatio
    ) {
        @Override
        public String toString() {
            return String.format(
                    "ScoreBreakdown{ratio=%.2f, tokenSort=%.2f, tokenSet=%.2f, partial=%.2f, partialToken=%.2f, weighted=%.2f}",
                    ratio, tokenSortRatio, tokenSetRatio, partialRatio, partialTokenRatio, weightedRatio
            );
        }
    }
}
