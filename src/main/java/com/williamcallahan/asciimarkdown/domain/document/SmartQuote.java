package com.williamcallahan.asciimarkdown.domain.document;

/**
 * Curly quotes and their straight ASCII replacements.
 */
public enum SmartQuote {
    LSQUO("'"),
    RSQUO("'"),
    LDQUO("\""),
    RDQUO("\"");

    private final String ascii;

    SmartQuote(String ascii) {
        this.ascii = ascii;
    }

    public String ascii() {
        return ascii;
    }
}
