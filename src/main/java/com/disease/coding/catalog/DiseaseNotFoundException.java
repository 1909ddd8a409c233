package com.disease.coding.catalog;

/**
 * Thrown when a catalog operation references a disease name that is not present.
 */
public class DiseaseNotFoundException extends RuntimeException {

    private final String diseaseName;

    public DiseaseNotFoundException(String diseaseName) {
        super("Disease not found: " + diseaseName);
        this.diseaseName = diseaseName;
    }

    public String getDiseaseName() {
        return diseaseName;
    }
}
