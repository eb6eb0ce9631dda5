package com.williamcallahan.asciimarkdown.domain.markdown;

/**
 * Response variants of the render cache statistics endpoint.
 */
public sealed interface MarkdownCacheStatsResponse permits MarkdownCacheStatsSnapshot, MarkdownErrorResponse {}
