package com.disease.coding.validation;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for InputSanitizer validation utility.
 */
class InputSanitizerTest {

    // ========== queries ==========

    @Test
    void query_rejectsNullAndBlank() {
        assertNotNull(InputSanitizer.describeQueryProblem(null));
        assertNotNull(InputSanitizer.describeQueryProblem(""));
        assertNotNull(InputSanitizer.describeQueryProblem("   "));
        assertEquals("No disease provided", InputSanitizer.describeQueryProblem(" "));
    }

    @Test
    void query_rejectsOverMaxLength() {
        String longQuery = "A".repeat(InputSanitizer.MAX_NAME_LENGTH + 1);
        assertNotNull(InputSanitizer.describeQueryProblem(longQuery));
    }

    @Test
    void query_acceptsMaxLength() {
        assertNull(InputSanitizer.describeQueryProblem("A".repeat(InputSanitizer.MAX_NAME_LENGTH)));
    }

    @Test
    void query_rejectsControlCharacters() {
        assertNotNull(InputSanitizer.describeQueryProblem("Asth\u0000ma"));
        assertNotNull(InputSanitizer.describeQueryProblem("Asth\u007Fma"));
    }

    @Test
    void query_allowsCommonWhitespace() {
        assertNull(InputSanitizer.describeQueryProblem("Diabetes\tmellitus\n"));
        assertNull(InputSanitizer.describeQueryProblem("Asthma"));
    }

    // ========== disease names ==========

    @Test
    void diseaseName_rejectsNullAndBlank() {
        assertThrows(IllegalArgumentException.class, () -> InputSanitizer.validateDiseaseName(null));
        assertThrows(IllegalArgumentException.class, () -> InputSanitizer.validateDiseaseName(" "));
        assertDoesNotThrow(() -> InputSanitizer.validateDiseaseName("Asthma"));
    }
}
