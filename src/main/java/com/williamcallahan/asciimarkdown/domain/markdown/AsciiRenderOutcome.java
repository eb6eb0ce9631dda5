package com.williamcallahan.asciimarkdown.domain.markdown;

import java.util.Objects;

/**
 * Describes a successful plain-text rendering.
 *
 * @param text rendered plain text
 * @param headers headers found in the document
 * @param items list items found in the document
 * @param unresolvedReferences references that rendered as {@code (???)}
 * @param processingTimeMs conversion time
 * @param cached whether the text came from the render cache
 */
public record AsciiRenderOutcome(
    String text,
    int headers,
    int items,
    int unresolvedReferences,
    long processingTimeMs,
    boolean cached
) implements AsciiRenderResponse {

    public AsciiRenderOutcome {
        Objects.requireNonNull(text, "Rendered text cannot be null");
        if (headers < 0 || items < 0 || unresolvedReferences < 0) {
            throw new IllegalArgumentException("Document counts must be non-negative");
        }
    }

    /**
     * Returns the outcome for blank input.
     *
     * @return empty outcome
     */
    public static AsciiRenderOutcome empty() {
        return new AsciiRenderOutcome("", 0, 0, 0, 0L, false);
    }
}
