package com.williamcallahan.asciimarkdown.domain.markdown;

import java.util.Objects;

/**
 * Describes a failed markdown request.
 */
public record MarkdownErrorResponse(String error, String details)
    implements AsciiRenderResponse, MarkdownCacheStatsResponse, MarkdownCacheClearResponse {
    public MarkdownErrorResponse {
        Objects.requireNonNull(error, "Error message cannot be null");
        details = details == null ? "" : details;
    }
}
