package com.williamcallahan.asciimarkdown.domain.markdown;

import java.util.Objects;

/**
 * Reports a cleared render cache.
 *
 * @param status "success"
 * @param removedEntries entries held by the cache before it was cleared
 */
public record MarkdownCacheClearOutcome(String status, long removedEntries) implements MarkdownCacheClearResponse {
    public MarkdownCacheClearOutcome {
        Objects.requireNonNull(status, "Cache clear status cannot be null");
        if (removedEntries < 0) {
            throw new IllegalArgumentException("Removed entry count must be non-negative");
        }
    }
}
