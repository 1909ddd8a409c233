package com.disease.coding.similarity;

/**
 * Single-row dynamic programming over two strings.
 * The row is sized by the shorter string, so both methods use O(min(m,n)) space.
 */
final class EditDistance {

    private EditDistance() {
    }

    /**
     * Length of the longest common subsequence.
     */
    static int longestCommonSubsequence(String a, String b) {
        String shorter = a.length() <= b.length() ? a : b;
        String longer = shorter == a ? b : a;
        int[] row = new int[shorter.length() + 1];

        for (int j = 0; j < longer.length(); j++) {
            char c = longer.charAt(j);
            int diagonal = 0;
            for (int i = 1; i <= shorter.length(); i++) {
                int above = row[i];
                row[i] = shorter.charAt(i - 1) == c
                        ? diagonal + 1
                        : Math.max(row[i - 1], above);
                diagonal = above;
            }
        }
        return row[shorter.length()];
    }

    /**
     * Levenshtein distance: insertions, deletions and substitutions each cost 1.
     */
    static int levenshtein(String a, String b) {
        String shorter = a.length() <= b.length() ? a : b;
        String longer = shorter == a ? b : a;
        int[] row = new int[shorter.length() + 1];
        for (int i = 0; i < row.length; i++) {
            row[i] = i;
        }

        for (int j = 0; j < longer.length(); j++) {
            char c = longer.charAt(j);
            int diagonal = row[0];
            row[0] = j + 1;
            for (int i = 1; i <= shorter.length(); i++) {
                int above = row[i];
                int substitution = diagonal + (shorter.charAt(i - 1) == c ? 0 : 1);
                row[i] = Math.min(substitution, Math.min(row[i - 1], above) + 1);
                diagonal = above;
            }
        }
        return row[shorter.length()];
    }
}
