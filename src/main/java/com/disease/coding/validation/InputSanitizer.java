package com.disease.coding.validation;

/**
 * Input validation for queries and canonical disease names.
 */
public final class InputSanitizer {

    /** Maximum allowed length for a query or disease name. */
    public static final int MAX_NAME_LENGTH = 1000;

    private InputSanitizer() {
        // utility class
    }

    /**
     * Describes why a query cannot be resolved, or returns null if it can.
     * A usable query is non-blank, within {@link #MAX_NAME_LENGTH} and free of
     * control characters.
     */
    public static String describeQueryProblem(String query) {
        if (query == null || query.isBlank()) {
            return "No disease provided";
        }
        if (query.length() > MAX_NAME_LENGTH) {
            return "Query exceeds maximum length of " + MAX_NAME_LENGTH +
                    " characters (was " + query.length() + ")";
        }
        if (containsControlCharacters(query)) {
            return "Query must not contain control characters";
        }
        return null;
    }

    /**
     * Validates a canonical disease name passed to a catalog operation.
     *
     * @param name the disease name
     * @throws IllegalArgumentException if the name is null or blank
     */
    public static void validateDiseaseName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Disease name must not be null or blank");
        }
    }

    /**
     * Checks whether a string contains ASCII control characters (0x00-0x1F, 0x7F),
     * excluding tab, newline and carriage return.
     */
    private static boolean containsControlCharacters(String s) {
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if ((c < 0x20 && c != '\t' && c != '\n' && c != '\r') || c == 0x7F) {
                return true;
            }
        }
        return false;
    }
}
