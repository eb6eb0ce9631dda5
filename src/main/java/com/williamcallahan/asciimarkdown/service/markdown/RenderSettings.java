package com.williamcallahan.asciimarkdown.service.markdown;

/**
 * Layout settings fixed for the lifetime of one renderer.
 *
 * @param maxColumn column budget for wrapped text and horizontal rules
 * @param wrap whether inline text is wrapped to the budget
 * @param debug whether output is annotated with node-kind markers
 */
public record RenderSettings(int maxColumn, boolean wrap, boolean debug) {

    public static final int DEFAULT_MAX_COLUMN = 80;

    public RenderSettings {
        if (maxColumn < 1) {
            throw new IllegalArgumentException("Max column must be positive");
        }
    }

    /**
     * Returns the production defaults: 80 columns, wrapping on, debug markers off.
     *
     * @return default settings
     */
    public static RenderSettings defaults() {
        return new RenderSettings(DEFAULT_MAX_COLUMN, true, false);
    }

    public RenderSettings withDebug(boolean enabled) {
        return new RenderSettings(maxColumn, wrap, enabled);
    }
}
