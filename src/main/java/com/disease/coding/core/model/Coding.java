package com.disease.coding.core.model;

import java.util.Objects;

/**
 * A single code within a classification system, with its display text.
 */
public record Coding(String system, String code, String display) {

    public Coding {
        Objects.requireNonNull(system, "system is required");
        Objects.requireNonNull(code, "code is required");
        Objects.requireNonNull(display, "display is required");
    }

    /**
     * Creates a coding for a disease name in the given system.
     */
    public static Coding of(CodingSystem system, String code, String diseaseName) {
        return new Coding(system.getSystemUri(), code, system.display(diseaseName));
    }
}
