package com.williamcallahan.asciimarkdown.config;

import java.util.Locale;

/**
 * Limits applied to markdown input before parsing.
 */
public class InputConfig {

    private static final int MAX_LENGTH_DEF = 100_000;
    private static final int MIN_POSITIVE = 1;
    private static final String MAX_LENGTH_KEY = "app.input.max-length";
    private static final String POSITIVE_FMT = "%s must be greater than 0.";

    private int maxLength = MAX_LENGTH_DEF;

    /**
     * Creates input configuration.
     */
    public InputConfig() {
    }

    /**
     * Validates input limits.
     */
    public void validateConfiguration() {
        if (maxLength < MIN_POSITIVE) {
            throw new IllegalArgumentException(String.format(Locale.ROOT, POSITIVE_FMT, MAX_LENGTH_KEY));
        }
    }

    /**
     * Returns the number of characters kept from a markdown input; longer input is truncated.
     *
     * @return maximum input length in chars
     */
    public int getMaxLength() {
        return maxLength;
    }

    public void setMaxLength(final int maxLength) {
        this.maxLength = maxLength;
    }
}
