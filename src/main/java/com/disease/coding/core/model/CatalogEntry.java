package com.disease.coding.core.model;

import java.util.Objects;

/**
 * A canonical disease name together with its coding pair.
 */
public record CatalogEntry(String name, CodeEntry entry) {

    public CatalogEntry {
        Objects.requireNonNull(name, "name is required");
        Objects.requireNonNull(entry, "entry is required");
    }
}
