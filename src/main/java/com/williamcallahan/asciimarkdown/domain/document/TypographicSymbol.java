package com.williamcallahan.asciimarkdown.domain.document;

/**
 * Typographic symbols and their plain ASCII approximations.
 */
public enum TypographicSymbol {
    MDASH("---"),
    NDASH("--"),
    HELLIP("..."),
    LAQUO_SPACE("<<"),
    RAQUO_SPACE(">>"),
    LAQUO("<< "),
    RAQUO(" >>");

    private final String ascii;

    TypographicSymbol(String ascii) {
        this.ascii = ascii;
    }

    public String ascii() {
        return ascii;
    }
}
