package com.williamcallahan.asciimarkdown.service.markdown;

/**
 * Ordinal styles for ordered list marks, chosen by how deeply the list is nested inside other
 * ordered lists: numbers, then lowercase letters, then lowercase roman numerals, then again.
 */
enum OrdinalStyle {
    NUMERIC,
    LETTER_LOWER,
    ROMAN_LOWER;

    private static final int ALPHABET_SIZE = 26;
    private static final int[] ROMAN_VALUES = {1000, 900, 500, 400, 100, 90, 50, 40, 10, 9, 5, 4, 1};
    private static final String[] ROMAN_SYMBOLS = {"m", "cm", "d", "cd", "c", "xc", "l", "xl", "x", "ix", "v", "iv", "i"};

    static OrdinalStyle forDepth(int orderedDepth) {
        OrdinalStyle[] styles = values();
        return styles[Math.floorMod(orderedDepth, styles.length)];
    }

    /**
     * Formats a one-based ordinal.
     *
     * @param ordinal ordinal to format; letters and roman numerals fall back to digits below 1
     * @return formatted mark such as {@code 3}, {@code c} or {@code iii}
     */
    String format(int ordinal) {
        if (this == NUMERIC || ordinal < 1) {
            return Integer.toString(ordinal);
        }
        return this == LETTER_LOWER ? letters(ordinal) : roman(ordinal);
    }

    // 27 -> aa, spreadsheet-column style
    private static String letters(int ordinal) {
        StringBuilder letters = new StringBuilder();
        int remaining = ordinal;
        while (remaining > 0) {
            remaining--;
            letters.insert(0, (char) ('a' + remaining % ALPHABET_SIZE));
            remaining /= ALPHABET_SIZE;
        }
        return letters.toString();
    }

    private static String roman(int ordinal) {
        StringBuilder roman = new StringBuilder();
        int remaining = ordinal;
        for (int index = 0; index < ROMAN_VALUES.length; index++) {
            while (remaining >= ROMAN_VALUES[index]) {
                roman.append(ROMAN_SYMBOLS[index]);
                remaining -= ROMAN_VALUES[index];
            }
        }
        return roman.toString();
    }
}
