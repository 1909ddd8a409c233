package com.disease.coding.similarity;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.regex.Pattern;

/**
 * Whitespace tokenization shared by the token-based ratios.
 */
final class Tokens {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private Tokens() {
    }

    static List<String> split(String s) {
        String trimmed = s.trim();
        if (trimmed.isEmpty()) {
            return List.of();
        }
        return Arrays.asList(WHITESPACE.split(trimmed));
    }

    static SortedSet<String> sortedSet(String s) {
        return new TreeSet<>(split(s));
    }

    static String sortedJoin(String s) {
        List<String> tokens = new ArrayList<>(split(s));
        tokens.sort(null);
        return String.join(" ", tokens);
    }

    static String join(Collection<String> tokens) {
        return String.join(" ", tokens);
    }
}
