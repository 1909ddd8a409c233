package com.disease.coding.catalog;

/**
 * Runtime exception thrown when the catalog seed cannot be read or is malformed.
 */
public class CatalogSeedException extends RuntimeException {

    public CatalogSeedException(String message) {
        super(message);
    }

    public CatalogSeedException(String message, Throwable cause) {
        super(message, cause);
    }
}
