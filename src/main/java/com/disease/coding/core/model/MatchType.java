package com.disease.coding.core.model;

/**
 * How a query was resolved against the catalog.
 */
public enum MatchType {
    /**
     * The query is identical to a canonical name (case-sensitive).
     * The scorer is not consulted.
     */
    EXACT,

    /**
     * Best-scoring canonical name, accepted because its score exceeds the threshold.
     */
    FUZZY,

    /**
     * No exact match and no candidate above the threshold.
     */
    NOT_FOUND
}
