package com.williamcallahan.asciimarkdown.service.markdown;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

/**
 * Tests column measurement of ASCII, wide and supplementary characters.
 */
class DisplayWidthTest {

    @Test
    void asciiCountsOneColumnPerChar() {
        assertEquals(11, DisplayWidth.of("hello world"));
    }

    @Test
    void nonAsciiCountsTwoColumns() {
        assertEquals(4, DisplayWidth.of("漢字"));
        assertEquals(2, DisplayWidth.of("é"));
    }

    @Test
    void supplementaryCodePointCountsOnce() {
        String emoji = new String(Character.toChars(0x1F600));
        assertEquals(2, emoji.length());
        assertEquals(2, DisplayWidth.of(emoji));
    }

    @Test
    void loneSurrogateCountsOneColumn() {
        assertEquals(1, DisplayWidth.of(0xD800));
        assertEquals(1, DisplayWidth.of(0xDFFF));
        assertEquals(1, DisplayWidth.of("\uD800"));
        assertEquals(3, DisplayWidth.of("a\uDC00b"));
    }

    @Test
    void nullAndEmptyAreZero() {
        assertEquals(0, DisplayWidth.of((CharSequence) null));
        assertEquals(0, DisplayWidth.of(""));
    }
}
