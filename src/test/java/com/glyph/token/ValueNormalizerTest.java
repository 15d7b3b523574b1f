package com.glyph.token;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ValueNormalizer.
 */
class ValueNormalizerTest {

    @ParameterizedTest
    @DisplayName("Should lowercase, strip punctuation and collapse whitespace")
    @CsvSource({
            "'Deploy App', deploy_app",
            "'  Deploy,   the App!! ', deploy_the_app",
            "'snake_case_value', snake_case_value",
            "'Build #42 (nightly)', build_42_nightly",
            "'Café Menu', café_menu"
    })
    void shouldCanonicalize(String raw, String expected) {
        assertEquals(expected, ValueNormalizer.canonicalize(raw));
    }

    @Test
    @DisplayName("Should map null and empty values to the empty string")
    void shouldHandleMissingValues() {
        assertEquals("", ValueNormalizer.canonicalize(null));
        assertEquals("", ValueNormalizer.canonicalize(""));
        assertEquals("", ValueNormalizer.canonicalize("?!"));
    }

    @Test
    @DisplayName("Spellings that differ only in case and punctuation normalize identically")
    void shouldTreatEquivalentSpellingsAsDuplicates() {
        assertEquals(ValueNormalizer.canonicalize("Run the Tests"),
                ValueNormalizer.canonicalize("run   the tests."));
    }
}
