package com.williamcallahan.asciimarkdown.service.markdown;

/**
 * Measures how many terminal columns text occupies.
 *
 * <p>Single-byte (ASCII) code points take one column, everything else takes two. A lone
 * surrogate cannot be measured and counts as one column.</p>
 */
public final class DisplayWidth {

    private static final int SINGLE_BYTE_LIMIT = 0x80;

    private DisplayWidth() {}

    /**
     * Returns the column width of a single code point.
     *
     * @param codePoint code point to measure
     * @return 1 or 2
     */
    public static int of(int codePoint) {
        if (codePoint < SINGLE_BYTE_LIMIT
            || (codePoint <= Character.MAX_VALUE && Character.isSurrogate((char) codePoint))) {
            return 1;
        }
        return 2;
    }

    /**
     * Returns the column width of a string.
     *
     * @param text text to measure, null counts as empty
     * @return total columns
     */
    public static int of(CharSequence text) {
        if (text == null) {
            return 0;
        }
        int width = 0;
        for (int index = 0; index < text.length(); ) {
            int codePoint = Character.codePointAt(text, index);
            width += of(codePoint);
            index += Character.charCount(codePoint);
        }
        return width;
    }
}
