package com.disease.coding.core.model;

/**
 * Classification systems a {@link CodeEntry} carries a code for.
 */
public enum CodingSystem {
    /**
     * WHO ICD-11, the primary classification.
     */
    ICD11("http://id.who.int/icd/release/11", ""),

    /**
     * ICD-11 Traditional Medicine chapter 2, the secondary classification.
     */
    TM2("http://example.org/tm2", " (TM2)");

    private final String systemUri;
    private final String displaySuffix;

    CodingSystem(String systemUri, String displaySuffix) {
        this.systemUri = systemUri;
        this.displaySuffix = displaySuffix;
    }

    public String getSystemUri() {
        return systemUri;
    }

    /**
     * Returns the display text used for a disease name in this system.
     */
    public String display(String diseaseName) {
        return diseaseName + displaySuffix;
    }
}
