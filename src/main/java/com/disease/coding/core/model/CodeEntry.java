package com.disease.coding.core.model;

import java.util.List;

/**
 * The coding pair stored for one canonical disease name.
 * Both codes are always present; an entry is replaced as a whole, never edited in place.
 *
 * @param primaryCode   code in the primary classification (ICD-11)
 * @param secondaryCode code in the secondary classification (TM2)
 */
public record CodeEntry(String primaryCode, String secondaryCode) {

    public CodeEntry {
        requireCode(primaryCode, "primaryCode");
        requireCode(secondaryCode, "secondaryCode");
    }

    /**
     * Returns the primary and secondary codings for the given canonical name, in that order.
     */
    public List<Coding> codings(String diseaseName) {
        return List.of(
                Coding.of(CodingSystem.ICD11, primaryCode, diseaseName),
                Coding.of(CodingSystem.TM2, secondaryCode, diseaseName)
        );
    }

    /**
     * Returns a copy with the primary code replaced.
     */
    public CodeEntry withPrimaryCode(String code) {
        return new CodeEntry(code, secondaryCode);
    }

    /**
     * Returns a copy with the secondary code replaced.
     */
    public CodeEntry withSecondaryCode(String code) {
        return new CodeEntry(primaryCode, code);
    }

    static void requireCode(String code, String field) {
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException(field + " must not be null or blank");
        }
    }
}
