package com.disease.coding.resolver;

/**
 * Thrown when a resolution query is empty, blank or otherwise unusable.
 * Callers should treat it as a client error.
 */
public class InvalidQueryException extends IllegalArgumentException {

    public InvalidQueryException(String message) {
        super(message);
    }
}
