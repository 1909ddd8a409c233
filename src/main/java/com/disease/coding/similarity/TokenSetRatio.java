package com.disease.coding.similarity;

import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Token-set similarity.
 * Splits both strings into token sets and compares the shared tokens against
 * each side's remainder. Returns 100 when one token set contains the other.
 */
public class TokenSetRatio implements SimilarityScorer {

    @Override
    public double score(String query, String candidate) {
        return compute(query, candidate);
    }

    @Override
    public String getName() {
        return "TokenSetRatio";
    }

    static double compute(String s1, String s2) {
        if (s1 == null || s2 == null) {
            return 0.0;
        }
        SortedSet<String> tokens1 = Tokens.sortedSet(s1);
        SortedSet<String> tokens2 = Tokens.sortedSet(s2);
        if (tokens1.isEmpty() || tokens2.isEmpty()) {
            return 0.0;
        }

        SortedSet<String> intersection = new TreeSet<>(tokens1);
        intersection.retainAll(tokens2);
        SortedSet<String> diff12 = new TreeSet<>(tokens1);
        diff12.removeAll(tokens2);
        SortedSet<String> diff21 = new TreeSet<>(tokens2);
        diff21.removeAll(tokens1);

        if (!intersection.isEmpty() && (diff12.isEmpty() || diff21.isEmpty())) {
            return 100.0;
        }

        String joined12 = Tokens.join(diff12);
        String joined21 = Tokens.join(diff21);
        int len12 = joined12.length();
        int len21 = joined21.length();
        int sectLen = Tokens.join(intersection).length();

        double result = IndelRatio.compute(joined12, joined21);
        if (sectLen == 0) {
            return result;
        }

        // "sect" vs "sect diff": the distance is the diff plus its separating space
        int sect12Len = sectLen + 1 + len12;
        int sect21Len = sectLen + 1 + len21;
        double sect12Ratio = 100.0 * (1.0 - (double) (1 + len12) / (sectLen + sect12Len));
        double sect21Ratio = 100.0 * (1.0 - (double) (1 + len21) / (sectLen + sect21Len));

        return Math.max(result, Math.max(sect12Ratio, sect21Ratio));
    }
}
