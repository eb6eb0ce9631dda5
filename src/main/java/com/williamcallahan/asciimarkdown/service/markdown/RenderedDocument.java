package com.williamcallahan.asciimarkdown.service.markdown;

import java.util.Objects;

/**
 * Result of converting one markdown document to plain text.
 *
 * @param text the rendered plain text
 * @param headers number of headers found by the reference pass
 * @param items number of list items found by the reference pass
 * @param labels number of distinct labels that name a header or list item
 * @param unresolvedReferences references rendered as the unresolved placeholder
 * @param processingTimeMs time spent converting, zero for cache hits
 * @param cached whether the result came from the render cache
 */
public record RenderedDocument(
    String text,
    int headers,
    int items,
    int labels,
    int unresolvedReferences,
    long processingTimeMs,
    boolean cached
) {

    public RenderedDocument {
        Objects.requireNonNull(text, "Rendered text cannot be null");
        if (headers < 0 || items < 0 || labels < 0 || unresolvedReferences < 0) {
            throw new IllegalArgumentException("Document counts must be non-negative");
        }
    }

    /**
     * Returns the result for blank input.
     *
     * @return empty document
     */
    public static RenderedDocument empty() {
        return new RenderedDocument("", 0, 0, 0, 0, 0L, false);
    }

    /**
     * Marks this result as served from the cache.
     *
     * @return copy flagged as cached
     */
    public RenderedDocument asCached() {
        return new RenderedDocument(text, headers, items, labels, unresolvedReferences, 0L, true);
    }

    /**
     * Checks whether every reference in the document resolved.
     *
     * @return true when no placeholder was emitted
     */
    public boolean isFullyResolved() {
        return unresolvedReferences == 0;
    }
}
