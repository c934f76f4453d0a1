package com.helmsman.core.text;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

class TextPreprocessorTest {

    private final TextPreprocessor preprocessor = new TextPreprocessor();

    @Test
    @DisplayName("collapses whitespace and newlines")
    void collapsesWhitespace() {
        assertEquals("Main engine overheating. Crew notified.",
                preprocessor.normalize("  Main   engine\n\toverheating.\r\n Crew notified.  "));
    }

    @Test
    @DisplayName("replaces characters outside the allowlist with spaces")
    void stripsDisallowedCharacters() {
        assertEquals("Pressure 120 psi alarm (aft) - check!",
                preprocessor.normalize("Pressure @120# psi *alarm* (aft) - check!"));
        assertEquals("Reading 12 05 2025", preprocessor.normalize("Reading 12/05/2025"));
    }

    @Test
    @DisplayName("collapses repeated dots and exclamation marks")
    void collapsesPunctuationRuns() {
        assertEquals("Leak detected. Act now!", preprocessor.normalize("Leak detected..... Act now!!!"));
    }

    @Test
    @DisplayName("keeps allowed punctuation")
    void keepsAllowedPunctuation() {
        assertEquals("a, b; c: d? e-f (g)", preprocessor.normalize("a, b; c: d? e-f (g)"));
    }

    @Test
    @DisplayName("keeps non-ASCII letters")
    void keepsUnicodeLetters() {
        assertEquals("Maschinenraum überhitzt", preprocessor.normalize("Maschinenraum überhitzt"));
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "   ", "\n\t", "@#$%^&*", "~~~ ### ///"})
    @DisplayName("whitespace or symbol-only input yields an empty string")
    void emptyAfterCleaning(String input) {
        assertEquals("", preprocessor.normalize(input));
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "Leak... !! . . #### engine",
            "a.#.b!#!c",
            "  spaced  text \n with   tabs\t.",
            "GPS malfunction -- poor visibility!!! fog...",
            "..!!..!!"
    })
    @DisplayName("normalize is idempotent")
    void idempotent(String input) {
        String once = preprocessor.normalize(input);
        assertEquals(once, preprocessor.normalize(once));
    }

    @Test
    @DisplayName("null input is a programming error")
    void nullInput() {
        assertThrows(NullPointerException.class, () -> preprocessor.normalize(null));
    }
}
