package com.williamcallahan.asciimarkdown.config;

import com.williamcallahan.asciimarkdown.service.markdown.RenderSettings;

import java.util.Locale;

/**
 * Plain-text layout configuration.
 */
public class RenderConfig {

    private static final int MIN_COLUMN = 1;
    private static final String MAX_COLUMN_KEY = "app.render.max-column";
    private static final String POSITIVE_FMT = "%s must be greater than 0.";

    private int maxColumn = RenderSettings.DEFAULT_MAX_COLUMN;
    private boolean wrap = true;
    private boolean debug;

    /**
     * Creates render configuration with default layout.
     */
    public RenderConfig() {
    }

    /**
     * Validates render settings.
     */
    public void validateConfiguration() {
        if (maxColumn < MIN_COLUMN) {
            throw new IllegalArgumentException(String.format(Locale.ROOT, POSITIVE_FMT, MAX_COLUMN_KEY));
        }
    }

    /**
     * Converts the bound properties into renderer settings.
     *
     * @return immutable render settings
     */
    public RenderSettings toSettings() {
        return new RenderSettings(maxColumn, wrap, debug);
    }

    public int getMaxColumn() {
        return maxColumn;
    }

    public void setMaxColumn(final int maxColumn) {
        this.maxColumn = maxColumn;
    }

    public boolean isWrap() {
        return wrap;
    }

    public void setWrap(final boolean wrap) {
        this.wrap = wrap;
    }

    /**
     * Returns whether rendered output carries block and span markers.
     *
     * @return whether debug markers are emitted
     */
    public boolean isDebug() {
        return debug;
    }

    public void setDebug(final boolean debug) {
        this.debug = debug;
    }
}
