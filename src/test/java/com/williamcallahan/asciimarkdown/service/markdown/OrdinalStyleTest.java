package com.williamcallahan.asciimarkdown.service.markdown;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.assertEquals;

/**
 * Tests ordered list mark formatting by nesting depth.
 */
class OrdinalStyleTest {

    @Test
    void forDepth_cyclesNumbersLettersRoman() {
        assertEquals(OrdinalStyle.NUMERIC, OrdinalStyle.forDepth(0));
        assertEquals(OrdinalStyle.LETTER_LOWER, OrdinalStyle.forDepth(1));
        assertEquals(OrdinalStyle.ROMAN_LOWER, OrdinalStyle.forDepth(2));
        assertEquals(OrdinalStyle.NUMERIC, OrdinalStyle.forDepth(3));
    }

    @Test
    void letters_continuePastZ() {
        assertEquals("a", OrdinalStyle.LETTER_LOWER.format(1));
        assertEquals("z", OrdinalStyle.LETTER_LOWER.format(26));
        assertEquals("aa", OrdinalStyle.LETTER_LOWER.format(27));
    }

    @ParameterizedTest
    @CsvSource({"1, i", "4, iv", "9, ix", "14, xiv", "40, xl", "1994, mcmxciv"})
    void roman_usesSubtractiveForms(int ordinal, String expected) {
        assertEquals(expected, OrdinalStyle.ROMAN_LOWER.format(ordinal));
    }

    @Test
    void nonPositiveOrdinalsFallBackToDigits() {
        assertEquals("0", OrdinalStyle.LETTER_LOWER.format(0));
        assertEquals("0", OrdinalStyle.ROMAN_LOWER.format(0));
    }
}
