package com.disease.coding.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of resolving a query against the catalog.
 * Only the single best match is reported.
 */
public record MatchResult(
        MatchType type,
        String name,
        CodeEntry entry,
        double score
) {
    public static final double EXACT_SCORE = 100.0;

    private static final MatchResult NOT_FOUND = new MatchResult(MatchType.NOT_FOUND, null, null, 0.0);

    public MatchResult {
        Objects.requireNonNull(type, "type is required");
        if (score < 0.0 || score > 100.0) {
            throw new IllegalArgumentException("Score must be between 0 and 100");
        }
        if (type != MatchType.NOT_FOUND) {
            Objects.requireNonNull(name, "name is required for a match");
            Objects.requireNonNull(entry, "entry is required for a match");
        }
    }

    public static MatchResult exact(String name, CodeEntry entry) {
        return new MatchResult(MatchType.EXACT, name, entry, EXACT_SCORE);
    }

    public static MatchResult fuzzy(String name, CodeEntry entry, double score) {
        return new MatchResult(MatchType.FUZZY, name, entry, score);
    }

    public static MatchResult notFound() {
        return NOT_FOUND;
    }

    public boolean hasMatch() {
        return type != MatchType.NOT_FOUND;
    }

    public boolean isExact() {
        return type == MatchType.EXACT;
    }

    public boolean isFuzzy() {
        return type == MatchType.FUZZY;
    }

    /**
     * Returns the "did you mean" hint for a fuzzy match, or null otherwise.
     */
    public String suggestion() {
        return isFuzzy() ? "Did you mean '" + name + "'?" : null;
    }

    /**
     * Returns the codings of the matched entry, or an empty list when nothing matched.
     */
    public List<Coding> codings() {
        return hasMatch() ? entry.codings(name) : List.of();
    }
}
