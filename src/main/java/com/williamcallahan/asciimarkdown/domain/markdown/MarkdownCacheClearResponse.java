package com.williamcallahan.asciimarkdown.domain.markdown;

/**
 * Response variants of the render cache clear endpoint.
 */
public sealed interface MarkdownCacheClearResponse
    permits MarkdownCacheClearOutcome, MarkdownErrorResponse {
}
